package com.soundbank.generator.registry;

import static com.soundbank.generator.support.Nodes.*;
import static org.assertj.core.api.Assertions.*;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.soundbank.generator.model.DeclaredBank;
import com.soundbank.generator.model.NodeRef;
import com.soundbank.generator.model.SourceNode;
import com.soundbank.generator.registry.hirc.HircObject;
import com.soundbank.generator.registry.hirc.SoundObject;
import com.soundbank.generator.registry.hirc.UnsupportedObject;

/**
 * Unit tests for NodeRegistry lookups, build caching and usage tracking.
 */
class NodeRegistryTest {

    private NodeRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new NodeRegistry();
        registry.registerBank(1, "Init.bnk");
        registry.registerBank(2, "Music.bnk");
    }

    @Test
    void testResolveReturnsExactBankNode() {
        SourceNode inFirst = sound(100, 9001);
        SourceNode inSecond = sound(100, 9002);
        registry.register(1, 100, inFirst);
        registry.register(2, 100, inSecond);

        assertThat(registry.resolve(1, 100)).containsSame(inFirst);
        assertThat(registry.resolve(2, 100)).containsSame(inSecond);
        assertThat(registry.getDiagnostics().getAmbiguousIds()).isEmpty();
    }

    @Test
    void testFirstRegistrationWins() {
        SourceNode first = sound(100, 9001);
        SourceNode repeated = sound(100, 9002);
        registry.register(1, 100, first);
        registry.register(1, 100, repeated);

        assertThat(registry.resolve(1, 100)).containsSame(first);
        assertThat(registry.getRegisteredCount()).isEqualTo(1);
        assertThat(registry.refOf(repeated)).isEmpty();
    }

    @Test
    void testFallbackToOtherBankIsDeterministicAndFlaggedOnce() {
        SourceNode inFirst = sound(100, 9001);
        SourceNode inSecond = sound(100, 9002);
        registry.register(1, 100, inFirst);
        registry.register(2, 100, inSecond);

        for (int i = 0; i < 3; i++) {
            assertThat(registry.resolve(3, 100)).containsSame(inFirst);
        }
        assertThat(registry.getDiagnostics().getAmbiguousIds()).containsExactly(100L);
    }

    @Test
    void testFallbackWithSingleCandidateIsNotAmbiguous() {
        SourceNode node = sound(100, 9001);
        registry.register(2, 100, node);

        assertThat(registry.resolve(1, 100)).containsSame(node);
        assertThat(registry.getDiagnostics().getAmbiguousIds()).isEmpty();
    }

    @Test
    void testMissingInLoadedBankRecordedOnce() {
        DeclaredBank declared = DeclaredBank.of(2, "Music");

        assertThat(registry.getOrBuild(2, 555, NodeRef.of(1, 10), declared)).isEmpty();
        assertThat(registry.getOrBuild(2, 555, NodeRef.of(1, 10), declared)).isEmpty();

        RegistryDiagnostics d = registry.getDiagnostics();
        assertThat(d.getMissingInLoadedBanks()).containsExactly(NodeRef.of(2, 555));
        assertThat(d.getMissingInOtherBanks()).isEmpty();
        assertThat(d.getMissingInUnknownBanks()).isEmpty();
        assertThat(d.getMissingBanks()).isEmpty();
    }

    @Test
    void testMissingInOtherBankRecordsBankName() {
        assertThat(registry.getOrBuild(7, 555, null, DeclaredBank.of(7, "Voices"))).isEmpty();

        RegistryDiagnostics d = registry.getDiagnostics();
        assertThat(d.getMissingInOtherBanks()).containsExactly(NodeRef.of(7, 555));
        assertThat(d.getMissingBanks()).containsExactly("Voices");
        assertThat(d.getMissingInLoadedBanks()).isEmpty();
        assertThat(d.getMissingInUnknownBanks()).isEmpty();
    }

    @Test
    void testMissingWithoutDeclaredBankIsUnknown() {
        assertThat(registry.getOrBuild(1, 555, null, null)).isEmpty();

        RegistryDiagnostics d = registry.getDiagnostics();
        assertThat(d.getMissingInUnknownBanks()).containsExactly(NodeRef.of(1, 555));
        assertThat(d.getMissingCount()).isEqualTo(1);
    }

    @Test
    void testMissingReferenceKeepsFirstBucket() {
        assertThat(registry.getOrBuild(1, 500, null, null)).isEmpty();
        assertThat(registry.getOrBuild(1, 500, null, DeclaredBank.of(1, "Init.bnk"))).isEmpty();
        assertThat(registry.getOrBuild(2, 501, null, DeclaredBank.of(2, "Music"))).isEmpty();
        assertThat(registry.getOrBuild(2, 501, null, null)).isEmpty();

        RegistryDiagnostics d = registry.getDiagnostics();
        assertThat(d.getMissingInUnknownBanks()).containsExactly(NodeRef.of(1, 500));
        assertThat(d.getMissingInLoadedBanks()).containsExactly(NodeRef.of(2, 501));
        assertThat(d.getMissingInOtherBanks()).isEmpty();
        assertThat(d.getMissingCount()).isEqualTo(2);
        assertThat(d.isMissing(NodeRef.of(1, 500))).isTrue();
    }

    @Test
    void testZeroIdsAreNotMissing() {
        assertThat(registry.getOrBuild(1, 0, null, null)).isEmpty();
        assertThat(registry.getOrBuild(0, 100, null, null)).isEmpty();

        assertThat(registry.getDiagnostics().getMissingCount()).isZero();
    }

    @Test
    void testBuildIsCachedByIdentity() {
        SourceNode node = sound(100, 9001);
        registry.register(1, 100, node);

        HircObject first = registry.build(node);
        HircObject second = registry.build(node);
        Optional<HircObject> viaLookup = registry.getOrBuild(1, 100, null, null);

        assertThat(first).isInstanceOf(SoundObject.class);
        assertThat(second).isSameAs(first);
        assertThat(viaLookup).containsSame(first);
        assertThat(first.getRef()).isEqualTo(NodeRef.of(1, 100));
    }

    @Test
    void testStructurallyEqualNodesBuildSeparately() {
        SourceNode a = sound(100, 9001);
        SourceNode b = sound(100, 9001);
        registry.register(1, 100, a);
        registry.register(2, 100, b);

        assertThat(registry.build(a)).isNotSameAs(registry.build(b));
    }

    @Test
    void testUnknownTypeBuildsUnsupportedObject() {
        SourceNode node = object("CAkDialogueEvent", sid(300));
        registry.register(1, 300, node);

        assertThat(registry.build(node)).isInstanceOf(UnsupportedObject.class);
        assertThat(registry.getDiagnostics().getUnsupportedTypes()).containsExactly("CAkDialogueEvent");
    }

    @Test
    void testListUnusedSkipsBuiltObjects() {
        SourceNode used = sound(100, 9001);
        SourceNode unused = sound(101, 9002);
        registry.register(1, 100, used);
        registry.register(1, 101, unused);

        registry.getOrBuild(1, 100, null, null);

        assertThat(registry.listUnused("CAkSound")).containsExactly(unused);
        assertThat(registry.isUsed(used)).isTrue();
        assertThat(registry.hasUnused(List.of("CAkSound"))).isTrue();

        registry.build(unused);
        assertThat(registry.hasUnused(List.of("CAkSound"))).isFalse();
    }

    @Test
    void testEmptyMusicSegmentIsNotReportedUnused() {
        SourceNode silent = musicSegment(200, new long[0]);
        SourceNode playable = musicSegment(201, new long[] { 300 });
        registry.register(1, 200, silent);
        registry.register(1, 201, playable);

        assertThat(registry.listUnused("CAkMusicSegment")).containsExactly(playable);
        // the peek needed for the check does not count as use
        assertThat(registry.isUsed(silent)).isFalse();
    }

    @Test
    void testUnknownPropsAreReported() {
        SourceNode node = sound(100, 9001,
                list("props", field("Volume", -3.0), field("CenterPCT", 50L)));
        registry.register(1, 100, node);

        registry.build(node);

        assertThat(registry.getDiagnostics().getUnknownProps()).containsExactly("CenterPCT");
    }

    @Test
    void testMalformedNodePropagates() {
        SourceNode node = object("CAkSound", sid(100));
        registry.register(1, 100, node);

        assertThatThrownBy(() -> registry.build(node))
                .isInstanceOf(MalformedNodeException.class)
                .hasMessageContaining("sourceID");
    }

    @Test
    void testRegisterAfterSealFails() {
        registry.seal();

        assertThat(registry.isSealed()).isTrue();
        assertThatThrownBy(() -> registry.register(1, 100, sound(100, 9001)))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> registry.registerBank(3, "Other.bnk"))
                .isInstanceOf(IllegalStateException.class);
    }
}

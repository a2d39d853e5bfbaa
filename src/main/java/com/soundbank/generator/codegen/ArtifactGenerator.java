package com.soundbank.generator.codegen;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.soundbank.generator.codegen.model.core.context.GenerationFlags;
import com.soundbank.generator.codegen.model.output.Artifact;
import com.soundbank.generator.codegen.model.output.ArtifactSink;
import com.soundbank.generator.model.LoadedBank;
import com.soundbank.generator.model.NodeRef;
import com.soundbank.generator.model.SourceNode;
import com.soundbank.generator.registry.HircType;
import com.soundbank.generator.registry.NodeRegistry;
import com.soundbank.generator.render.HierarchyRenderer;
import com.soundbank.generator.render.Renderer;
import com.soundbank.generator.render.state.GenerationState;
import com.soundbank.generator.render.state.ParamCombo;
import com.soundbank.generator.render.state.SecondaryObject;
import com.soundbank.generator.render.state.SelectorCombo;
import com.soundbank.generator.render.state.StateChunkCombo;

/**
 * Renders every root object of the loaded banks once per distinct state combination and
 * hands each result to the sink.
 *
 * For one root object the combinations are found by rendering: a base render discovers
 * selector combos, rendering under each selector combo discovers state-chunk combos, and
 * rendering under each state-chunk combo discovers parameter combos. State chunks that the
 * current selectors make unreachable are rendered in a second pass, after every reachable
 * branch of the selector loop.
 */
public class ArtifactGenerator {
    private static final Logger log = LoggerFactory.getLogger(ArtifactGenerator.class);

    private enum ChunkPass {
        REACHABLE,
        UNREACHABLE
    }

    private final GenerationFlags flags;
    private final List<LoadedBank> banks;
    private final NodeRegistry registry;
    private final Renderer renderer;
    private final ArtifactSink sink;
    private final NodeFilter filter;
    private final GenerationState state;

    // per root object
    private boolean unusedPass;
    private boolean defaultStateChunk;

    private int rootsProcessed;
    private int unusedRootsProcessed;
    private int artifactsPublished;
    private int secondaryArtifactsPublished;

    public ArtifactGenerator(GeneratorConfig config, List<LoadedBank> banks, ArtifactSink sink) {
        this(config, banks, new NodeRegistry(), sink);
    }

    private ArtifactGenerator(GeneratorConfig config, List<LoadedBank> banks, NodeRegistry registry, ArtifactSink sink) {
        this(config, banks, registry, new HierarchyRenderer(registry), sink);
    }

    public ArtifactGenerator(GeneratorConfig config, List<LoadedBank> banks, NodeRegistry registry,
            Renderer renderer, ArtifactSink sink) {
        Objects.requireNonNull(config, "config");
        this.flags = config.getFlags();
        this.banks = List.copyOf(banks);
        this.registry = Objects.requireNonNull(registry, "registry");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.filter = new NodeFilter(config.getFilters(), flags.isGenerateRest());
        this.state = new GenerationState(config.getFixedSelectors(), config.getFixedParams());
    }

    /**
     * Run the whole generation. A failure in one root object aborts the run.
     *
     * @throws ArtifactGenerationException with the failing object's id and bank
     */
    public GeneratorResult generate() {
        long start = System.currentTimeMillis();
        log.info("Starting artifact generation...");

        log.info("Step 1: Registering hierarchy objects...");
        setup();

        log.info("Step 2: Rendering bank objects...");
        writeNormal();

        log.info("Step 3: Checking unused objects...");
        writeUnused();

        log.info("Artifact generation complete!");

        return GeneratorResult.builder()
                .banksLoaded(banks.size())
                .objectsRegistered(registry.getRegisteredCount())
                .rootsProcessed(rootsProcessed)
                .unusedRootsProcessed(unusedRootsProcessed)
                .artifactsPublished(artifactsPublished)
                .secondaryArtifactsPublished(secondaryArtifactsPublished)
                .generationTimeMillis(System.currentTimeMillis() - start)
                .diagnostics(registry.getDiagnostics())
                .build();
    }

    public NodeRegistry getRegistry() {
        return registry;
    }

    // ---- setup ----

    private void setup() {
        for (LoadedBank bank : banks) {
            registry.registerBank(bank.getBankId(), bank.getFilename());
        }

        for (LoadedBank bank : banks) {
            int count = 0;
            for (SourceNode item : bank.getItems()) {
                Optional<SourceNode> sid = item.findSid();
                if (sid.isEmpty()) {
                    log.debug("Skipped {} without id in {}", item.getName(), bank.getFilename());
                    continue;
                }
                registry.register(bank.getBankId(), sid.get().longValue(), item);
                count++;
            }
            log.debug("Registered {} objects from {}", count, bank.getFilename());
        }

        registry.seal();
        log.info("Registered {} objects from {} banks", registry.getRegisteredCount(), banks.size());
    }

    // ---- passes ----

    private void writeNormal() {
        CandidateOrdering ordering = new CandidateOrdering(filter, flags.isBankOrder());
        unusedPass = false;

        for (LoadedBank bank : banks) {
            List<SourceNode> roots = ordering.order(bank.getItems());
            log.info("Rendering {} objects from {}", roots.size(), bank.getFilename());
            for (SourceNode root : roots) {
                if (registry.refOf(root).isEmpty()) {
                    // repeated registration, already rendered as the first copy
                    continue;
                }
                renderRoot(root);
                rootsProcessed++;
            }
        }
    }

    private void writeUnused() {
        List<String> typeNames = HircType.unusedTypeNames();
        if (!flags.isGenerateUnused()) {
            if (registry.hasUnused(typeNames)) {
                log.info("Some objects were not used by any event, use --unused to render them");
            }
            return;
        }

        unusedPass = true;
        try {
            // earlier types can mark later ones used, so each list is taken when its turn comes
            for (String typeName : typeNames) {
                List<SourceNode> nodes = registry.listUnused(typeName);
                if (nodes.isEmpty()) {
                    continue;
                }
                log.info("Rendering {} unused {} objects", nodes.size(), typeName);

                for (SourceNode node : nodes) {
                    if (registry.isUsed(node)) {
                        continue;
                    }
                    if (filter.isActive() && !filter.allowUnused(node)) {
                        continue;
                    }
                    renderRoot(node);
                    unusedRootsProcessed++;
                }
            }
        } finally {
            unusedPass = false;
        }
    }

    // ---- per root object ----

    private void renderRoot(SourceNode node) {
        NodeRef ref = registry.refOf(node).orElse(null);
        try {
            state.reset();
            defaultStateChunk = false;

            String rootName = renderBase(node);
            renderSecondaries(ref, rootName);
        } catch (RuntimeException e) {
            long id = ref != null ? ref.getId() : 0;
            String bankName = ref != null ? registry.getBankName(ref.getBankId()).orElse("?") : "?";
            log.error("Error processing node {} in {}", id, bankName);
            throw new ArtifactGenerationException(id, bankName, e);
        }
    }

    /**
     * Base render; returns the root's display name for tagging secondary artifacts.
     */
    private String renderBase(SourceNode node) {
        Artifact base = render(node);

        List<SelectorCombo> combos = state.getSelectorCombos();
        if (combos.isEmpty()) {
            renderStateChunks(node, base, ChunkPass.REACHABLE);
        } else {
            renderSelectors(node, combos);
        }
        return base.getRootName();
    }

    private void renderSelectors(SourceNode node, List<SelectorCombo> combos) {
        List<SelectorCombo> deferred = new ArrayList<>();

        for (SelectorCombo combo : combos) {
            state.resetStateChunks();
            state.applySelectors(combo);
            Artifact artifact = render(node);

            if (state.hasUnreachableStateChunks()) {
                deferred.add(combo);
            }
            renderStateChunks(node, artifact, ChunkPass.REACHABLE);
        }

        for (SelectorCombo combo : deferred) {
            state.resetStateChunks();
            state.applySelectors(combo);
            Artifact artifact = render(node);
            renderStateChunks(node, artifact, ChunkPass.UNREACHABLE);
        }
    }

    /**
     * @param artifact render made under the current selectors, published as is when no
     *        state chunks were found
     */
    private void renderStateChunks(SourceNode node, Artifact artifact, ChunkPass pass) {
        List<StateChunkCombo> combos = state.getStateChunkCombos();
        if (combos.isEmpty()) {
            if (pass == ChunkPass.REACHABLE) {
                renderParams(node, artifact);
            }
            return;
        }

        boolean reachable = pass == ChunkPass.REACHABLE;
        for (StateChunkCombo combo : combos) {
            if (combo.isReachable() != reachable) {
                continue;
            }
            state.resetParams();
            state.applyStateChunk(combo);
            renderParams(node, render(node));
        }

        if (reachable && state.needsDefaultStateChunk(combos)) {
            state.resetParams();
            state.applyStateChunk(null);
            defaultStateChunk = true;
            try {
                renderParams(node, render(node));
            } finally {
                defaultStateChunk = false;
            }
        }
    }

    private void renderParams(SourceNode node, Artifact artifact) {
        List<ParamCombo> combos = state.getParamCombos();
        if (combos.isEmpty()) {
            renderLast(artifact);
            return;
        }

        for (ParamCombo combo : combos) {
            state.applyParams(combo);
            renderLast(render(node));
        }
    }

    private void renderLast(Artifact artifact) {
        publish(artifact);
        artifactsPublished++;
    }

    private void renderSecondaries(NodeRef caller, String callerName) {
        List<SecondaryObject> secondaries = List.copyOf(state.getSecondaryObjects());
        for (SecondaryObject secondary : secondaries) {
            state.reset();

            Artifact artifact = new Artifact();
            artifact.setCaller(caller);
            artifact.setCallerName(callerName);
            artifact.setSecondary(secondary);
            renderer.beginSecondary(artifact, secondary, state);

            publish(artifact);
            secondaryArtifactsPublished++;
        }
    }

    // ---- helpers ----

    private Artifact render(SourceNode node) {
        Artifact artifact = new Artifact();
        renderer.begin(artifact, node, state);
        return artifact;
    }

    private void publish(Artifact artifact) {
        artifact.setCombination(state.snapshot());
        artifact.setDefaultStateChunk(defaultStateChunk);
        artifact.setUnused(unusedPass);
        artifact.setSuppressed(unusedPass ? flags.isSkipUnused() : flags.isSkipNormal());
        sink.publish(artifact);
    }
}

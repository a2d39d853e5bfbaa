package com.soundbank.generator.registry;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import com.soundbank.generator.registry.hirc.ActionPlayObject;
import com.soundbank.generator.registry.hirc.ContainerObject;
import com.soundbank.generator.registry.hirc.EventObject;
import com.soundbank.generator.registry.hirc.HircObject;
import com.soundbank.generator.registry.hirc.MusicSegmentObject;
import com.soundbank.generator.registry.hirc.MusicSwitchObject;
import com.soundbank.generator.registry.hirc.MusicTrackObject;
import com.soundbank.generator.registry.hirc.SoundObject;
import com.soundbank.generator.registry.hirc.SwitchContainerObject;

/**
 * Hierarchy object types with a construction contract. Types not listed here are built as
 * {@link com.soundbank.generator.registry.hirc.UnsupportedObject}.
 */
public enum HircType {
    EVENT("CAkEvent", EventObject::new),
    ACTION_PLAY("CAkActionPlay", ActionPlayObject::new),
    SOUND("CAkSound", SoundObject::new),
    RANSEQ_CONTAINER("CAkRanSeqCntr", ContainerObject::playlist),
    LAYER_CONTAINER("CAkLayerCntr", ContainerObject::layered),
    SWITCH_CONTAINER("CAkSwitchCntr", SwitchContainerObject::new),
    MUSIC_RANSEQ_CONTAINER("CAkMusicRanSeqCntr", ContainerObject::playlist),
    MUSIC_SWITCH_CONTAINER("CAkMusicSwitchCntr", MusicSwitchObject::new),
    MUSIC_SEGMENT("CAkMusicSegment", MusicSegmentObject::new),
    MUSIC_TRACK("CAkMusicTrack", MusicTrackObject::new);

    /** Types that start an artifact when no filter says otherwise. */
    public static final Set<HircType> ROOT_TYPES = EnumSet.of(EVENT);

    /**
     * Unused detection order. Rendering a type may mark objects of later types as used, so
     * outer types come first.
     */
    public static final List<HircType> UNUSED_PRIORITY = List.of(
            EVENT,
            ACTION_PLAY,
            LAYER_CONTAINER,
            SWITCH_CONTAINER,
            RANSEQ_CONTAINER,
            SOUND,
            MUSIC_SWITCH_CONTAINER,
            MUSIC_RANSEQ_CONTAINER,
            MUSIC_SEGMENT,
            MUSIC_TRACK);

    private static final Map<String, HircType> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(HircType::getTypeName, Function.identity()));

    private final String typeName;
    private final Supplier<HircObject> factory;

    HircType(String typeName, Supplier<HircObject> factory) {
        this.typeName = typeName;
        this.factory = factory;
    }

    public String getTypeName() {
        return typeName;
    }

    public HircObject create() {
        return factory.get();
    }

    /**
     * Silent segments carry no children and are not worth reporting as leftovers.
     */
    public boolean isIgnoredWhenEmpty() {
        return this == MUSIC_SEGMENT;
    }

    public static Optional<HircType> fromName(String typeName) {
        return Optional.ofNullable(BY_NAME.get(typeName));
    }

    public static boolean isRootType(String typeName) {
        return fromName(typeName).map(ROOT_TYPES::contains).orElse(false);
    }

    public static List<String> unusedTypeNames() {
        return UNUSED_PRIORITY.stream().map(HircType::getTypeName).toList();
    }
}

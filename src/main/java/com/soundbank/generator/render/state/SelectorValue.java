package com.soundbank.generator.render.state;

import lombok.EqualsAndHashCode;
import lombok.Value;

/**
 * One selector assignment, e.g. {@code music=bgm01}. Names are display-only.
 */
@Value(staticConstructor = "of")
public class SelectorValue {

    GroupType type;
    long groupId;
    long valueId;

    @EqualsAndHashCode.Exclude
    String groupName;

    @EqualsAndHashCode.Exclude
    String valueName;

    public static SelectorValue of(GroupType type, long groupId, long valueId) {
        return of(type, groupId, valueId, null, null);
    }

    public boolean sameGroup(GroupType otherType, long otherGroupId) {
        return type == otherType && groupId == otherGroupId;
    }

    @Override
    public String toString() {
        return (groupName != null ? groupName : String.valueOf(groupId))
                + "=" + (valueName != null ? valueName : String.valueOf(valueId));
    }
}

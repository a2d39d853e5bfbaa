package com.soundbank.generator.render.state;

import lombok.EqualsAndHashCode;
import lombok.Value;

/**
 * One state of a state-chunk group.
 */
@Value(staticConstructor = "of")
public class StateValue {

    long groupId;
    long stateId;

    @EqualsAndHashCode.Exclude
    String groupName;

    @EqualsAndHashCode.Exclude
    String stateName;

    public static StateValue of(long groupId, long stateId) {
        return of(groupId, stateId, null, null);
    }

    @Override
    public String toString() {
        return (groupName != null ? groupName : String.valueOf(groupId))
                + "=" + (stateName != null ? stateName : String.valueOf(stateId));
    }
}

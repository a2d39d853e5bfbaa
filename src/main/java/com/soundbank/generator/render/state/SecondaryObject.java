package com.soundbank.generator.render.state;

import com.soundbank.generator.model.NodeRef;

import lombok.EqualsAndHashCode;
import lombok.Value;

/**
 * A playable object met as a side effect of rendering (stinger or transition segment),
 * published later as its own artifact.
 */
@Value(staticConstructor = "of")
public class SecondaryObject {

    public enum Kind {
        STINGER,
        TRANSITION
    }

    Kind kind;
    NodeRef target;

    /** Trigger id for stingers, 0 for transitions. */
    long triggerId;

    @EqualsAndHashCode.Exclude
    NodeRef owner;

    public static SecondaryObject stinger(NodeRef target, long triggerId, NodeRef owner) {
        return of(Kind.STINGER, target, triggerId, owner);
    }

    public static SecondaryObject transition(NodeRef target, NodeRef owner) {
        return of(Kind.TRANSITION, target, 0, owner);
    }

    @Override
    public String toString() {
        return kind == Kind.STINGER
                ? "stinger=" + triggerId + " " + target.getId()
                : "transition=" + target.getId();
    }
}

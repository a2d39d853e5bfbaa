package com.soundbank.generator.render.state;

/**
 * Kind of selector group. State groups double as state-chunk groups, which is what makes a
 * state-chunk combination unreachable under a contradicting selector choice.
 */
public enum GroupType {
    SWITCH,
    STATE;

    public static GroupType fromCode(long code) {
        return code == 1 ? STATE : SWITCH;
    }
}

package com.soundbank.generator.codegen.model.output;

/**
 * How the entries of a group play.
 */
public enum GroupKind {
    LAYERED("layer"),
    RANDOM("random"),
    SEQUENCE("sequence");

    private final String keyword;

    GroupKind(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }
}

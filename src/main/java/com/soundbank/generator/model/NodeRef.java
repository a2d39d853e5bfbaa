package com.soundbank.generator.model;

import lombok.Value;

/**
 * Identifies one hierarchy object: bank id plus short id. Not globally unique, since the same
 * short id may legitimately exist in several banks.
 */
@Value(staticConstructor = "of")
public class NodeRef {

    long bankId;
    long id;

    @Override
    public String toString() {
        return bankId + ":" + id;
    }
}

package com.soundbank.generator.model;

import lombok.Value;

/**
 * Target bank declared on a reference (e.g. a play action pointing into another bank).
 */
@Value(staticConstructor = "of")
public class DeclaredBank {

    long bankId;

    /** Hashed bank name when known, otherwise the id as text. */
    String displayName;

    public static DeclaredBank from(SourceNode field) {
        long bankId = field.longValue();
        return of(bankId, field.getHashName().orElse(String.valueOf(bankId)));
    }
}

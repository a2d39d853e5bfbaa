package com.soundbank.generator.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A bank as handed over by the bank parser: numeric id, source filename and the top-level
 * hierarchy items in declaration order. Media-only banks have no items.
 */
@Value
@Builder(toBuilder = true)
public class LoadedBank {

    long bankId;

    @NonNull
    String filename;

    @Singular
    List<SourceNode> items;
}

package com.soundbank.generator.codegen;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import com.soundbank.generator.model.SourceNode;
import com.soundbank.generator.registry.HircType;

/**
 * Picks and orders the root objects of one bank.
 *
 * Allow-listed objects come first, whatever their type. The rest, with no filter or in
 * "rest" mode, are root-type objects only: named ones sorted by name, then unnamed ones
 * sorted by id. Named objects
 * first means that when several events do the same thing the named one is kept and the
 * others become duplicates. With bank order everything keeps declaration order.
 */
public class CandidateOrdering {

    private final NodeFilter filter;
    private final boolean bankOrder;

    public CandidateOrdering(NodeFilter filter, boolean bankOrder) {
        this.filter = filter;
        this.bankOrder = bankOrder;
    }

    private static final class Candidate {
        final String name;
        final long id;
        final SourceNode node;

        Candidate(String name, long id, SourceNode node) {
            this.name = name;
            this.id = id;
            this.node = node;
        }
    }

    public List<SourceNode> order(List<SourceNode> items) {
        List<SourceNode> allowed = new ArrayList<>();
        List<Candidate> named = new ArrayList<>();
        List<Candidate> unnamed = new ArrayList<>();

        for (SourceNode node : items) {
            Optional<SourceNode> sid = node.findSid();
            if (sid.isEmpty()) {
                continue;
            }

            if (filter.isActive()) {
                if (filter.allowOuter(node)) {
                    allowed.add(node);
                    continue;
                }
                if (!filter.isGenerateRest()) {
                    continue;
                }
            }

            if (!HircType.isRootType(node.getName())) {
                continue;
            }

            Optional<String> hashName = sid.get().getHashName();
            if (hashName.isPresent() && !bankOrder) {
                named.add(new Candidate(hashName.get(), sid.get().longValue(), node));
            } else {
                unnamed.add(new Candidate(null, sid.get().longValue(), node));
            }
        }

        if (!bankOrder) {
            named.sort(Comparator.comparing(c -> c.name));
            unnamed.sort(Comparator.comparingLong(c -> c.id));
        }

        List<SourceNode> ordered = new ArrayList<>(allowed);
        named.forEach(c -> ordered.add(c.node));
        unnamed.forEach(c -> ordered.add(c.node));
        return ordered;
    }
}

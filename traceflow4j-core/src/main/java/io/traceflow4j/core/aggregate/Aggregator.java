/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.aggregate;

import io.traceflow4j.core.api.model.ExceptionRecord;
import io.traceflow4j.core.api.model.Group;
import io.traceflow4j.core.api.model.StackFrame;
import io.traceflow4j.core.normalize.SignatureNormalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Groups records by normalized signature.
 *
 * <p>Groups come back ordered by count (descending), ties by creation order, so the first group is
 * the most common one and equal counts resolve to the earliest seen.
 */
public final class Aggregator {

    private final SignatureNormalizer normalizer;
    private final Set<String> hidePaths;

    /**
     * @param normalizer builds the grouping key
     * @param hidePaths  path fragments (e.g. {@code site-packages}) whose frames are skipped when
     *                   picking a group's anchor; a record whose frames are all hidden still
     *                   anchors on its first frame
     */
    public Aggregator(SignatureNormalizer normalizer, List<String> hidePaths) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.hidePaths = Set.copyOf(hidePaths == null ? List.of() : hidePaths);
    }

    public List<Group> aggregate(List<ExceptionRecord> records) {
        Map<String, Builder> bySignature = new LinkedHashMap<>();
        for (int i = 0; i < records.size(); i++) {
            ExceptionRecord r = records.get(i);
            String sig = normalizer.signatureOf(r);
            int index = i;
            bySignature.computeIfAbsent(sig, s -> new Builder(s, r, index)).add(anchorOf(r));
        }

        List<Group> groups = new ArrayList<>(bySignature.size());
        for (Builder b : bySignature.values()) groups.add(b.build());
        groups.sort(Comparator.comparingInt(Group::count).reversed().thenComparingInt(Group::firstSeenIndex));
        return List.copyOf(groups);
    }

    private StackFrame anchorOf(ExceptionRecord r) {
        for (StackFrame f : r.frames()) {
            if (!isHidden(f.file())) return f;
        }
        return r.firstFrame().orElse(null);
    }

    private boolean isHidden(String file) {
        for (String p : hidePaths) {
            if (file.contains(p)) return true;
        }
        return false;
    }

    private static final class Builder {
        private final String signature;
        private final ExceptionRecord representative;
        private final int firstSeenIndex;
        private int count;
        private StackFrame anchor;

        Builder(String signature, ExceptionRecord representative, int firstSeenIndex) {
            this.signature = signature;
            this.representative = representative;
            this.firstSeenIndex = firstSeenIndex;
        }

        void add(StackFrame candidate) {
            count++;
            if (anchor == null) anchor = candidate;
        }

        Group build() {
            return new Group(signature, count, representative, anchor, firstSeenIndex);
        }
    }
}

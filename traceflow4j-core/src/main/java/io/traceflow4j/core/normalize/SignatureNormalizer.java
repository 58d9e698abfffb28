/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.normalize;

import io.traceflow4j.core.api.InvalidControlInputException;
import io.traceflow4j.core.api.model.ExceptionRecord;
import io.traceflow4j.core.api.model.StackFrame;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Strips volatile substrings so structurally identical exceptions share one signature.
 *
 * <p>Stages run per line, in this order:
 * <ol>
 *   <li>leading timestamp prefixes are removed</li>
 *   <li>runs of six or more hex characters become {@value HexRunMatcher#PLACEHOLDER}</li>
 *   <li>caller rules, in the order given</li>
 * </ol>
 *
 * The stages are re-applied to a line until it no longer changes, so {@link #normalize(String)} is
 * idempotent even when a replacement forms a new match with the text around it. A rule whose
 * placeholder is rewritten again on its own is rejected when the normalizer is built.
 */
public final class SignatureNormalizer {

    // a placeholder may complete a match together with its neighbours, so passes repeat until stable
    private static final int MAX_PASSES = 16;

    private final List<TokenMatcher> stages;

    public SignatureNormalizer(List<SubstitutionRule> rules) {
        List<TokenMatcher> out = new ArrayList<>();
        out.add(new TimestampPrefixMatcher());
        out.add(new HexRunMatcher());
        for (SubstitutionRule r : Objects.requireNonNullElse(rules, List.<SubstitutionRule>of())) {
            out.add(Objects.requireNonNull(r, "rule").toMatcher());
        }
        this.stages = List.copyOf(out);

        for (SubstitutionRule r : Objects.requireNonNullElse(rules, List.<SubstitutionRule>of())) {
            String p = r.placeholder();
            if (!normalize(p).equals(p)) {
                throw new InvalidControlInputException("Placeholder '" + p + "' of substitution '" + r.regex()
                        + "' would be rewritten again; choose a placeholder no stage matches");
            }
        }
    }

    public static SignatureNormalizer defaults() {
        return new SignatureNormalizer(List.of());
    }

    public String normalize(String text) {
        if (text == null || text.isEmpty()) return text;
        String[] lines = text.split("\n", -1);
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) out.append('\n');
            out.append(normalizeLine(lines[i]));
        }
        return out.toString();
    }

    /** Grouping key: grammar, headline and frames, normalized. */
    public String signatureOf(ExceptionRecord record) {
        StringBuilder sb = new StringBuilder(128);
        sb.append(record.grammar().name()).append('\n').append(record.headline());
        for (StackFrame f : record.frames()) {
            sb.append('\n').append("  at ").append(f.pretty());
        }
        return normalize(sb.toString());
    }

    private String normalizeLine(String line) {
        String cur = line;
        for (int pass = 0; pass < MAX_PASSES; pass++) {
            String next = cur;
            for (TokenMatcher stage : stages) {
                next = replace(next, stage.find(next));
            }
            if (next.equals(cur)) return cur;
            cur = next;
        }
        return cur;
    }

    private static String replace(String line, MatchResult result) {
        if (!result.found()) return line;
        List<MatchResult.Match> all = new ArrayList<>(result.matches());

        // merge overlaps (by earliest start, prefer longer match)
        all.sort(Comparator.comparingInt(MatchResult.Match::start)
                .thenComparing(Comparator.comparingInt(MatchResult.Match::end).reversed()));
        List<MatchResult.Match> merged = new ArrayList<>();
        for (MatchResult.Match m : all) {
            if (!merged.isEmpty() && m.start() < merged.get(merged.size() - 1).end()) {
                MatchResult.Match last = merged.get(merged.size() - 1);
                merged.set(merged.size() - 1, new MatchResult.Match(
                        last.start(), Math.max(last.end(), m.end()), last.type(), last.replacement()));
            } else {
                merged.add(m);
            }
        }

        StringBuilder out = new StringBuilder(line.length() + 16);
        int pos = 0;
        for (MatchResult.Match m : merged) {
            if (m.start() > pos) out.append(line, pos, m.start());
            out.append(m.replacement());
            pos = Math.max(pos, m.end());
        }
        if (pos < line.length()) out.append(line, pos, line.length());
        return out.toString();
    }
}

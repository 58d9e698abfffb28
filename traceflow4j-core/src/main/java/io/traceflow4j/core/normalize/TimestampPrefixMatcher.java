/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.normalize;

import io.traceflow4j.core.util.Timestamps;
import java.util.List;

/** Leading timestamp prefixes, however many are stacked, together with the blanks around them. */
public final class TimestampPrefixMatcher implements TokenMatcher {
    private static final String TYPE = "timestamp";

    @Override
    public MatchResult find(String s) {
        if (s == null || s.isEmpty()) return MatchResult.empty();
        int end = 0;
        while (true) {
            int ws = end;
            while (ws < s.length() && Character.isWhitespace(s.charAt(ws))) ws++;
            int n = Timestamps.prefixLength(s.substring(ws));
            if (n == 0) break;
            end = ws + n;
        }
        if (end == 0) return MatchResult.empty();
        while (end < s.length() && Character.isWhitespace(s.charAt(end))) end++;
        return new MatchResult(true, List.of(new MatchResult.Match(0, end, TYPE, "")));
    }
}

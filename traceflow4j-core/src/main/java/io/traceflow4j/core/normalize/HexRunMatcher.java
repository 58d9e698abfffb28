/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs of six or more hex characters (request ids, trace ids, pointers), optionally
 * {@code 0x}-prefixed. A run has to stand on its own: it may not be glued to other letters or digits.
 */
public final class HexRunMatcher implements TokenMatcher {
    public static final String PLACEHOLDER = "<hex>";
    private static final String TYPE = "hex";
    private static final Pattern HEX_RUN = Pattern.compile("(?<![0-9A-Za-z])(?:0[xX])?[0-9a-fA-F]{6,}(?![0-9A-Za-z])");

    @Override
    public MatchResult find(String s) {
        if (s == null || s.isEmpty()) return MatchResult.empty();
        List<MatchResult.Match> matches = new ArrayList<>();
        Matcher m = HEX_RUN.matcher(s);
        while (m.find()) matches.add(new MatchResult.Match(m.start(), m.end(), TYPE, PLACEHOLDER));
        return matches.isEmpty() ? MatchResult.empty() : new MatchResult(true, List.copyOf(matches));
    }
}

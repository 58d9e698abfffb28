/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class RegexTokenMatcher implements TokenMatcher {
    private final String type;
    private final Pattern pattern;
    private final String replacement;

    public RegexTokenMatcher(String type, Pattern pattern, String replacement) {
        this.type = Objects.requireNonNull(type, "type");
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.replacement = Objects.requireNonNull(replacement, "replacement");
    }

    public String type() {
        return type;
    }

    @Override
    public MatchResult find(String input) {
        if (input == null || input.isEmpty()) return MatchResult.empty();
        Matcher m = pattern.matcher(input);
        List<MatchResult.Match> matches = new ArrayList<>();
        while (m.find()) {
            matches.add(new MatchResult.Match(m.start(), m.end(), type, replacement));
        }
        return matches.isEmpty() ? MatchResult.empty() : new MatchResult(true, List.copyOf(matches));
    }
}

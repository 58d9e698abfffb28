/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.normalize;

import io.traceflow4j.core.api.InvalidControlInputException;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Caller-supplied volatile token: every match of {@code regex} becomes {@code placeholder}.
 * Example: {@code order \d+ not found} → {@code order <id> not found}.
 */
public record SubstitutionRule(String regex, String placeholder) {

    public SubstitutionRule {
        Objects.requireNonNull(regex, "regex");
        Objects.requireNonNull(placeholder, "placeholder");
        if (regex.isEmpty()) throw new InvalidControlInputException("Substitution pattern must not be empty");
    }

    public static SubstitutionRule of(String regex, String placeholder) {
        return new SubstitutionRule(regex, placeholder);
    }

    /** Literal substring rule. */
    public static SubstitutionRule literal(String text, String placeholder) {
        return new SubstitutionRule(Pattern.quote(Objects.requireNonNull(text, "text")), placeholder);
    }

    TokenMatcher toMatcher() {
        try {
            return new RegexTokenMatcher("rule", Pattern.compile(regex), placeholder);
        } catch (PatternSyntaxException e) {
            throw new InvalidControlInputException("Invalid substitution pattern '" + regex + "'", e);
        }
    }
}

/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.api.model;

import io.traceflow4j.core.api.InvalidControlInputException;
import java.util.Objects;
import java.util.Optional;

/**
 * Caller's grammar choice: either probe dynamically or use one named grammar.
 *
 * @param grammar the explicit grammar, or {@code null} for dynamic selection
 */
public record GrammarSelection(GrammarId grammar) {

    public static final String DYNAMIC_NAME = "dynamic";

    private static final GrammarSelection DYNAMIC = new GrammarSelection(null);

    public static GrammarSelection dynamic() {
        return DYNAMIC;
    }

    public static GrammarSelection explicit(GrammarId grammar) {
        return new GrammarSelection(Objects.requireNonNull(grammar, "grammar"));
    }

    /** Parses {@code "dynamic"} or a grammar name. */
    public static GrammarSelection parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidControlInputException("Grammar selector must not be empty");
        }
        if (DYNAMIC_NAME.equalsIgnoreCase(value.trim())) return dynamic();
        return explicit(GrammarId.parse(value));
    }

    public boolean isDynamic() {
        return grammar == null;
    }

    public Optional<GrammarId> explicitGrammar() {
        return Optional.ofNullable(grammar);
    }

    @Override
    public String toString() {
        return isDynamic() ? DYNAMIC_NAME : grammar.displayName();
    }
}

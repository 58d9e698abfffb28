/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.api;

import io.traceflow4j.core.api.model.GrammarSelection;
import io.traceflow4j.core.api.model.IngestionMode;
import io.traceflow4j.core.api.model.Limits;
import io.traceflow4j.core.normalize.SubstitutionRule;
import java.util.List;
import java.util.Objects;

/**
 * One invocation's inputs.
 *
 * @param text      raw log text; null is treated as empty
 * @param mode      how the text is cut into candidate spans
 * @param selection grammar to apply, or dynamic probing
 * @param rules     extra volatile-token substitutions, applied after the built-in ones
 * @param debug     record grammar probe decisions in {@link Analysis#trace()}
 * @param limits    caps applied to the input before tokenizing
 */
public record AnalysisRequest(
        String text,
        IngestionMode mode,
        GrammarSelection selection,
        List<SubstitutionRule> rules,
        boolean debug,
        Limits limits) {

    public AnalysisRequest {
        text = text == null ? "" : text;
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(selection, "selection");
        rules = rules == null ? List.of() : List.copyOf(rules);
        limits = limits == null ? Limits.defaults() : limits;
    }

    public static AnalysisRequest of(String text, IngestionMode mode, GrammarSelection selection) {
        return new AnalysisRequest(text, mode, selection, List.of(), false, Limits.defaults());
    }

    /**
     * Builds a request from string control inputs, e.g. {@code ("multiline", "dynamic")} or
     * {@code ("split", "GoLangJson")}.
     *
     * @throws InvalidControlInputException for an unknown mode or grammar name
     */
    public static AnalysisRequest parse(String text, String mode, String grammar) {
        return of(text, IngestionMode.parse(mode), GrammarSelection.parse(grammar));
    }

    public AnalysisRequest withRules(List<SubstitutionRule> rules) {
        return new AnalysisRequest(text, mode, selection, rules, debug, limits);
    }

    public AnalysisRequest withDebug(boolean debug) {
        return new AnalysisRequest(text, mode, selection, rules, debug, limits);
    }

    public AnalysisRequest withLimits(Limits limits) {
        return new AnalysisRequest(text, mode, selection, rules, debug, limits);
    }
}

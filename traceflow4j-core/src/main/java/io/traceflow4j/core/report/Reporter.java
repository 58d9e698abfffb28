/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.report;

import io.traceflow4j.core.api.model.GrammarId;
import io.traceflow4j.core.api.model.Group;
import java.util.List;
import java.util.Objects;

/** Turns ranked groups into a {@link Report}. */
public final class Reporter {

    private final ReportRenderer renderer;

    public Reporter() {
        this(new ReportRenderer());
    }

    public Reporter(ReportRenderer renderer) {
        this.renderer = Objects.requireNonNull(renderer, "renderer");
    }

    public Report report(List<Group> groups, boolean truncated, GrammarId grammar) {
        return new Report(groups, truncated, grammar, renderer);
    }
}

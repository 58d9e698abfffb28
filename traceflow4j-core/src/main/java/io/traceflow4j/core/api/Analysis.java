/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.api;

import io.traceflow4j.core.api.model.ExceptionRecord;
import io.traceflow4j.core.report.Report;
import io.traceflow4j.core.select.Selection;
import java.util.List;

/** Result of {@link TraceAnalyzer#analyze(AnalysisRequest)}. */
public record Analysis(Selection selection, Report report) {

    /** Extracted records in stream order. */
    public List<ExceptionRecord> records() {
        return selection.records();
    }

    /** Probe decisions; empty unless the request asked for debug output. */
    public List<String> trace() {
        return selection.trace();
    }
}

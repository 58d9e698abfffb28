/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.report;

/** Receives every finished report, e.g. to export counters. */
public interface AnalysisObserver {
    void onReport(Report report);
}

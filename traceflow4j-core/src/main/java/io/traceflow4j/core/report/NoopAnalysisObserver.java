/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.report;

public final class NoopAnalysisObserver implements AnalysisObserver {
    @Override
    public void onReport(Report report) {
        /* no-op */
    }
}

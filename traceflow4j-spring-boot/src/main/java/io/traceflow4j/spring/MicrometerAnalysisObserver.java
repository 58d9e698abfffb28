/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.spring;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import io.traceflow4j.core.api.model.GrammarId;
import io.traceflow4j.core.report.AnalysisObserver;
import io.traceflow4j.core.report.Report;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/** Counts extracted records per grammar and keeps a ring of recent report summaries. */
public final class MicrometerAnalysisObserver implements AnalysisObserver {

    static final String RECORDS_METRIC = "traceflow4j_records_total";
    static final String TRUNCATED_METRIC = "traceflow4j_truncated_total";
    static final String NO_GRAMMAR = "none";

    private final MeterRegistry registry;
    private final Deque<Summary> ring = new ArrayDeque<>();
    private final int capacity;
    private final int anchorDepth;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "MeterRegistry is a framework-managed, thread-safe component; "
                    + "keeping a reference is required for metrics reporting and it is not exposed via accessors.")
    public MicrometerAnalysisObserver(MeterRegistry registry, int capacity, int anchorDepth) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.capacity = Math.max(10, capacity);
        this.anchorDepth = Math.max(1, anchorDepth);
    }

    @Override
    public synchronized void onReport(Report report) {
        if (report == null) return;
        String grammar = report.grammar().map(GrammarId::displayName).orElse(NO_GRAMMAR);
        registry.counter(RECORDS_METRIC, "grammar", grammar).increment(report.totalRecords());
        if (report.truncated()) registry.counter(TRUNCATED_METRIC).increment();

        if (ring.size() >= capacity) ring.removeFirst();
        ring.addLast(new Summary(
                grammar,
                report.totalRecords(),
                report.groups().size(),
                report.mostCommon().map(g -> g.representative().headline()).orElse(""),
                report.anchor(anchorDepth),
                report.truncated()));
    }

    /** Returns an unmodifiable snapshot of the recent summaries, oldest first. */
    public synchronized List<Summary> recentReports() {
        return List.copyOf(ring);
    }

    /** What the endpoint shows for one analysis. */
    public record Summary(
            String grammar, int records, int groups, String mostCommon, String anchor, boolean truncated) {}
}

/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.spring;

import io.traceflow4j.core.api.Analysis;
import io.traceflow4j.core.api.AnalysisRequest;
import io.traceflow4j.core.api.TraceAnalyzer;
import io.traceflow4j.core.api.model.GrammarSelection;
import io.traceflow4j.core.api.model.IngestionMode;
import io.traceflow4j.core.api.model.Limits;
import java.util.Objects;

/**
 * {@link TraceAnalyzer} bound to the configured mode, grammar, debug flag and limits. Control
 * inputs are parsed once, when the bean is created, so a bad value fails application startup.
 */
public class TraceflowService {

    private final TraceAnalyzer analyzer;
    private final IngestionMode mode;
    private final GrammarSelection selection;
    private final boolean debug;
    private final Limits limits;

    public TraceflowService(TraceAnalyzer analyzer, TraceflowProperties props) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
        this.mode = IngestionMode.parse(props.getMode());
        this.selection = GrammarSelection.parse(props.getGrammar());
        this.debug = props.isDebug();
        this.limits = props.limits();
    }

    public Analysis analyze(String text) {
        return analyzer.analyze(request(text));
    }

    /** The configured request for {@code text}, for callers that want to adjust it further. */
    public AnalysisRequest request(String text) {
        return AnalysisRequest.of(text, mode, selection).withDebug(debug).withLimits(limits);
    }

    public TraceAnalyzer analyzer() {
        return analyzer;
    }
}

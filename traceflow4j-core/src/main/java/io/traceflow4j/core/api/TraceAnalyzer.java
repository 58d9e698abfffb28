/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.api;

import io.traceflow4j.core.aggregate.Aggregator;
import io.traceflow4j.core.api.model.Group;
import io.traceflow4j.core.api.model.LogStream;
import io.traceflow4j.core.grammar.GrammarRegistry;
import io.traceflow4j.core.normalize.SignatureNormalizer;
import io.traceflow4j.core.normalize.SubstitutionRule;
import io.traceflow4j.core.report.AnalysisObserver;
import io.traceflow4j.core.report.NoopAnalysisObserver;
import io.traceflow4j.core.report.Report;
import io.traceflow4j.core.report.Reporter;
import io.traceflow4j.core.select.GrammarSelector;
import io.traceflow4j.core.select.Selection;
import io.traceflow4j.core.tokenize.Tokenizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: log text in, ranked report out.
 *
 * <p>Holds configuration only; every call builds its own stream, cursor and groups, so one
 * instance can serve concurrent callers.
 */
public final class TraceAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(TraceAnalyzer.class);

    private final GrammarSelector selector;
    private final List<SubstitutionRule> baseRules;
    private final SignatureNormalizer baseNormalizer;
    private final List<String> hidePaths;
    private final Reporter reporter;
    private final AnalysisObserver observer;

    public TraceAnalyzer() {
        this(List.of(), List.of(), new Reporter(), new NoopAnalysisObserver());
    }

    /**
     * @param baseRules substitutions applied to every request, before the request's own rules
     * @param hidePaths path fragments skipped when choosing anchor frames
     */
    public TraceAnalyzer(
            List<SubstitutionRule> baseRules, List<String> hidePaths, Reporter reporter, AnalysisObserver observer) {
        this.selector = new GrammarSelector(new GrammarRegistry(), new Tokenizer());
        this.baseRules = List.copyOf(baseRules);
        this.hidePaths = List.copyOf(hidePaths);
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.observer = observer == null ? new NoopAnalysisObserver() : observer;
        this.baseNormalizer = new SignatureNormalizer(this.baseRules);
    }

    public Analysis analyze(AnalysisRequest request) {
        Objects.requireNonNull(request, "request");
        SignatureNormalizer normalizer = normalizerFor(request);

        LogStream stream = LogStream.of(request.text(), request.mode(), request.limits());
        if (stream.truncated()) {
            log.warn("Input truncated to {} of {} line(s) (limits: {} lines, {} bytes); report covers the prefix only",
                    stream.lines().size(), stream.totalLines(), request.limits().maxLines(), request.limits().maxBytes());
        }

        Selection selection = selector.select(stream, request.selection(), request.debug());
        List<Group> groups = new Aggregator(normalizer, hidePaths).aggregate(selection.records());
        Report report = reporter.report(groups, stream.truncated(), selection.lockedGrammar());
        log.debug("Analyzed {} line(s): {} record(s), {} group(s), grammar {}",
                stream.lines().size(), report.totalRecords(), groups.size(), selection.locked().orElse(null));

        observer.onReport(report);
        return new Analysis(selection, report);
    }

    private SignatureNormalizer normalizerFor(AnalysisRequest request) {
        if (request.rules().isEmpty()) return baseNormalizer;
        List<SubstitutionRule> all = new ArrayList<>(baseRules.size() + request.rules().size());
        all.addAll(baseRules);
        all.addAll(request.rules());
        return new SignatureNormalizer(all);
    }
}

/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.select;

import io.traceflow4j.core.api.model.ExceptionRecord;
import io.traceflow4j.core.api.model.GrammarSelection;
import io.traceflow4j.core.api.model.LogStream;
import io.traceflow4j.core.grammar.Grammar;
import io.traceflow4j.core.grammar.GrammarRegistry;
import io.traceflow4j.core.tokenize.Span;
import io.traceflow4j.core.tokenize.Tokenizer;
import io.traceflow4j.core.tokenize.Tokenizer.SpanCursor;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.MessageFormatter;

/**
 * Applies either one named grammar or dynamic probing to a stream.
 *
 * <p>Dynamic probing tries every grammar, in {@link GrammarRegistry#priority()} order, on each
 * span until one parses it. That grammar is then locked: it alone tokenizes and parses the rest
 * of the stream, and no other grammar is consulted again, even if it stops matching.
 */
public final class GrammarSelector {

    private static final Logger log = LoggerFactory.getLogger(GrammarSelector.class);

    private final GrammarRegistry registry;
    private final Tokenizer tokenizer;

    public GrammarSelector(GrammarRegistry registry, Tokenizer tokenizer) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
    }

    public Selection select(LogStream stream, GrammarSelection selection, boolean trace) {
        Objects.requireNonNull(stream, "stream");
        Objects.requireNonNull(selection, "selection");
        Tracer tracer = new Tracer(trace);
        SpanCursor cursor = tokenizer.open(stream);
        return selection
                .explicitGrammar()
                .map(id -> explicit(cursor, registry.get(id), tracer))
                .orElseGet(() -> dynamic(cursor, tracer));
    }

    private Selection explicit(SpanCursor cursor, Grammar grammar, Tracer tracer) {
        List<Grammar> inPlay = List.of(grammar);
        List<ExceptionRecord> records = new ArrayList<>();
        Optional<Span> span;
        while ((span = cursor.next(inPlay)).isPresent()) {
            grammar.parse(span.get()).ifPresent(records::add);
        }
        tracer.note("explicit grammar {} produced {} record(s)", grammar.id(), records.size());
        return new Selection(grammar.id(), records, tracer.lines());
    }

    private Selection dynamic(SpanCursor cursor, Tracer tracer) {
        List<Grammar> all = registry.inPriorityOrder();
        List<ExceptionRecord> records = new ArrayList<>();
        Grammar locked = null;
        int probed = 0;
        Optional<Span> span;
        while ((span = cursor.next(locked == null ? all : List.of(locked))).isPresent()) {
            Span s = span.get();
            if (locked != null) {
                locked.parse(s).ifPresent(records::add);
                continue;
            }
            probed++;
            for (Grammar g : all) {
                Optional<ExceptionRecord> r = g.parse(s);
                if (r.isPresent()) {
                    locked = g;
                    records.add(r.get());
                    tracer.note("locked grammar {} at line {} after probing {} span(s)", g.id(), s.firstLine() + 1, probed);
                    break;
                }
            }
            if (locked == null) tracer.note("no grammar matched span at line {}", s.firstLine() + 1);
        }
        if (locked == null) {
            tracer.note("dynamic probing found no grammar over {} span(s)", probed);
            return new Selection(null, records, tracer.lines());
        }
        tracer.note("grammar {} produced {} record(s)", locked.id(), records.size());
        return new Selection(locked.id(), records, tracer.lines());
    }

    /** Collects probe decisions when tracing is on; otherwise only logs them at DEBUG. */
    private static final class Tracer {
        private final boolean enabled;
        private final List<String> lines = new ArrayList<>();

        Tracer(boolean enabled) {
            this.enabled = enabled;
        }

        void note(String format, Object... args) {
            if (enabled) {
                String line = MessageFormatter.arrayFormat(format, args).getMessage();
                lines.add(line);
                log.info("[trace] {}", line);
            } else if (log.isDebugEnabled()) {
                log.debug(format, args);
            }
        }

        List<String> lines() {
            return lines;
        }
    }
}

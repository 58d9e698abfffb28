/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.grammar;

import io.traceflow4j.core.api.model.ExceptionRecord;
import io.traceflow4j.core.api.model.GrammarId;
import io.traceflow4j.core.tokenize.Span;
import io.traceflow4j.core.util.Timestamps;
import java.util.List;
import java.util.Optional;

/** Plain-text Python tracebacks. The span has to start with the traceback header. */
public final class PythonGrammar implements Grammar {

    @Override
    public GrammarId id() {
        return GrammarId.PYTHON;
    }

    @Override
    public boolean isHeader(String line) {
        return PythonTracebacks.isHeader(Timestamps.strip(line));
    }

    @Override
    public boolean isContinuation(List<String> block, String line) {
        return PythonTracebacks.isContinuation(block, line);
    }

    @Override
    public Optional<ExceptionRecord> parse(Span span) {
        if (!isHeader(span.first())) return Optional.empty();
        var parsed = PythonTracebacks.parse(Frames.stripTimestamps(span.lines()));
        String type = parsed.type() == null ? "Traceback" : parsed.type();
        return Optional.of(new ExceptionRecord(
                span.text(),
                id(),
                type,
                parsed.message(),
                parsed.frames(),
                Timestamps.leading(span.first()).orElse(null),
                null));
    }
}

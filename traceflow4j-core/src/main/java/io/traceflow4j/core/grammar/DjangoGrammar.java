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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Python tracebacks as emitted by Django's request logger:
 *
 * <pre>
 * Internal Server Error: /api/orders/
 * Traceback (most recent call last):
 *   File "/app/venv/lib/python3.11/site-packages/django/core/handlers/exception.py", line 55, in inner
 * ...
 * </pre>
 *
 * A bare traceback qualifies only when one of its frames runs through the {@code django} package.
 */
public final class DjangoGrammar implements Grammar {

    static final Pattern SERVER_ERROR = Pattern.compile("((?:Internal )?Server Error): (/\\S*)");

    @Override
    public GrammarId id() {
        return GrammarId.DJANGO;
    }

    @Override
    public boolean isHeader(String line) {
        String l = Timestamps.strip(line);
        return SERVER_ERROR.matcher(l).find() || PythonTracebacks.isHeader(l);
    }

    @Override
    public boolean isContinuation(List<String> block, String line) {
        if (block.size() == 1 && SERVER_ERROR.matcher(Timestamps.strip(block.get(0))).find()) {
            return PythonTracebacks.isHeader(Timestamps.strip(line));
        }
        return PythonTracebacks.isContinuation(block, line);
    }

    @Override
    public Optional<ExceptionRecord> parse(Span span) {
        List<String> lines = Frames.stripTimestamps(span.lines());
        String first = lines.get(0);
        Matcher err = SERVER_ERROR.matcher(first);
        boolean serverError = err.find();
        if (!serverError && !PythonTracebacks.isHeader(first)) return Optional.empty();

        String endpoint = serverError ? err.group(2) : null;
        var parsed = PythonTracebacks.parse(lines);
        if (!serverError && !Frames.anyFileContains(parsed.frames(), "django/")) return Optional.empty();

        String type;
        if (parsed.type() != null) type = parsed.type();
        else if (parsed.headerSeen()) type = "Traceback";
        else type = err.group(1);

        return Optional.of(new ExceptionRecord(
                span.text(),
                id(),
                type,
                parsed.type() == null ? "" : parsed.message(),
                parsed.frames(),
                Timestamps.leading(span.first()).orElse(null),
                endpoint));
    }
}

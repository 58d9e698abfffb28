/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.grammar;

import com.fasterxml.jackson.databind.JsonNode;
import io.traceflow4j.core.api.model.ExceptionRecord;
import io.traceflow4j.core.api.model.GrammarId;
import io.traceflow4j.core.tokenize.Span;
import io.traceflow4j.core.util.JsonLogs;
import io.traceflow4j.core.util.JsonLogs.JsonLine;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Python tracebacks wrapped in structured JSON log records. The traceback is the value of one
 * of the usual text fields, e.g.
 *
 * <pre>
 * {"severity": "ERROR", "message": "Traceback (most recent call last):\n  File ...\nKeyError: 'id'"}
 * </pre>
 *
 * or sits inside an {@code event} that embeds a second object after {@code "with data "}:
 *
 * <pre>
 * {"event": "error handling request with data {\"exception\": \"...\", \"stacktrace\": \"Traceback ...\"}"}
 * </pre>
 *
 * A field whose value is itself a JSON object (Google Cloud wrapping a DRF response) is
 * unwrapped once.
 */
public final class DjangoJsonGrammar implements Grammar {

    private static final String[] TEXT_FIELDS = {
        "message", "msg", "detail", "event", "exc_info", "exception", "stacktrace", "stack_trace", "traceback", "error"
    };
    private static final String[] TIMESTAMP_FIELDS = {"timestamp", "time", "asctime", "@timestamp"};
    private static final String[] ENDPOINT_FIELDS = {"path", "request_path", "httpRequest.requestUrl", "request.path"};
    private static final String WITH_DATA = "with data {";

    @Override
    public GrammarId id() {
        return GrammarId.DJANGO_JSON;
    }

    @Override
    public boolean isHeader(String line) {
        if (line == null || !line.contains("Traceback")) return false;
        return JsonLogs.parseLine(line).flatMap(j -> traceback(j.node(), true)).isPresent();
    }

    /** One JSON object per record. */
    @Override
    public boolean isContinuation(List<String> block, String line) {
        return false;
    }

    @Override
    public Optional<ExceptionRecord> parse(Span span) {
        Optional<JsonLine> json = JsonLogs.parseLine(span.first());
        if (json.isEmpty()) return Optional.empty();
        JsonLine j = json.get();
        Optional<String> tb = traceback(j.node(), true);
        if (tb.isEmpty()) return Optional.empty();

        List<String> lines = fromHeader(Frames.stripTimestamps(Arrays.asList(tb.get().split("\\R"))));
        var parsed = PythonTracebacks.parse(lines);
        String timestamp = j.text(TIMESTAMP_FIELDS).orElse(j.prefix().isEmpty() ? null : j.prefix());
        return Optional.of(new ExceptionRecord(
                span.text(),
                id(),
                parsed.type() == null ? "Traceback" : parsed.type(),
                parsed.message(),
                parsed.frames(),
                timestamp,
                j.text(ENDPOINT_FIELDS).orElse(null)));
    }

    private static Optional<String> traceback(JsonNode node, boolean unwrap) {
        for (String field : TEXT_FIELDS) {
            Optional<String> value = JsonLogs.text(node, field);
            if (value.isEmpty()) continue;
            String v = value.get();
            if (unwrap && v.trim().startsWith("{")) {
                Optional<String> nested = JsonLogs.readObject(v.trim()).flatMap(n -> traceback(n, false));
                if (nested.isPresent()) return nested;
            }
            int withData = v.indexOf(WITH_DATA);
            if (withData >= 0) {
                Optional<String> embedded = embeddedStacktrace(v.substring(withData + WITH_DATA.length() - 1));
                if (embedded.isPresent()) return embedded;
            }
            if (containsHeaderLine(v)) return Optional.of(v);
        }
        return Optional.empty();
    }

    private static Optional<String> embeddedStacktrace(String s) {
        int[] range = JsonLogs.balancedBraces(s);
        if (range[0] < 0) return Optional.empty();
        return JsonLogs.readObject(s.substring(range[0], range[1]))
                .flatMap(n -> JsonLogs.text(n, "stacktrace", "traceback"))
                .filter(DjangoJsonGrammar::containsHeaderLine);
    }

    private static boolean containsHeaderLine(String text) {
        for (String l : text.split("\\R")) {
            if (PythonTracebacks.isHeader(l)) return true;
        }
        return false;
    }

    private static List<String> fromHeader(List<String> lines) {
        for (int i = 0; i < lines.size(); i++) {
            if (PythonTracebacks.isHeader(lines.get(i))) return lines.subList(i, lines.size());
        }
        return lines;
    }
}

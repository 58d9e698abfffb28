/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.grammar;

import io.traceflow4j.core.api.model.ExceptionRecord;
import io.traceflow4j.core.api.model.GrammarId;
import io.traceflow4j.core.tokenize.Span;
import io.traceflow4j.core.util.JsonLogs;
import io.traceflow4j.core.util.JsonLogs.JsonLine;
import io.traceflow4j.core.util.Timestamps;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Go panics reported through a structured logger (zap, zerolog, slog). The record is a JSON
 * object whose message mentions the panic; the stack is either a field of the object, part of a
 * multi-line message, or written raw on the lines that follow it.
 */
public final class GoJsonGrammar implements Grammar {

    private static final String[] MESSAGE_FIELDS = {"msg", "message", "error", "err", "panic"};
    private static final String[] STACK_FIELDS = {"stacktrace", "stack", "panic", "error"};
    private static final String[] TIMESTAMP_FIELDS = {"timestamp", "time", "ts", "@timestamp"};
    private static final String[] ENDPOINT_FIELDS = {"path", "url", "uri", "request.path", "httpRequest.requestUrl"};
    private static final Pattern JSON_START = Pattern.compile("^\\s*\\{\\s*\"");

    @Override
    public GrammarId id() {
        return GrammarId.GO_JSON;
    }

    @Override
    public boolean isHeader(String line) {
        if (line == null || line.indexOf('{') < 0) return false;
        String lower = line.toLowerCase(Locale.ROOT);
        if (!lower.contains("panic") && !lower.contains("goroutine")) return false;
        return JsonLogs.parseLine(line).filter(GoJsonGrammar::mentionsPanic).isPresent();
    }

    /** Raw Go stack lines following the JSON record belong to it. */
    @Override
    public boolean isContinuation(List<String> block, String line) {
        String l = Timestamps.strip(line);
        if (JSON_START.matcher(l).find()) return false;
        if (l.isBlank()) return block.size() > 1 && !Timestamps.strip(block.get(block.size() - 1)).isBlank();
        return GoGrammar.isStackLine(l);
    }

    @Override
    public Optional<ExceptionRecord> parse(Span span) {
        Optional<JsonLine> json = JsonLogs.parseLine(span.first()).filter(GoJsonGrammar::mentionsPanic);
        if (json.isEmpty()) return Optional.empty();
        JsonLine j = json.get();
        String msg = j.text(MESSAGE_FIELDS).orElse("");

        List<String> dump = new ArrayList<>();
        addLines(dump, msg);
        j.text(STACK_FIELDS).filter(s -> !s.equals(msg)).ifPresent(s -> addLines(dump, s));
        for (String raw : span.lines().subList(1, span.lines().size())) dump.add(Timestamps.strip(raw));

        GoGrammar.Parsed p = GoGrammar.parseDump(dump);
        String message = p.markerFound() ? p.message() : firstLine(msg);
        String timestamp = j.text(TIMESTAMP_FIELDS).orElse(j.prefix().isEmpty() ? null : j.prefix());
        return Optional.of(new ExceptionRecord(
                span.text(), id(), p.type(), message, p.frames(), timestamp, j.text(ENDPOINT_FIELDS).orElse(null)));
    }

    private static boolean mentionsPanic(JsonLine j) {
        String msg = j.text(MESSAGE_FIELDS).orElse("").toLowerCase(Locale.ROOT);
        return msg.contains("panic") || msg.contains("goroutine ");
    }

    private static void addLines(List<String> out, String text) {
        if (text.isEmpty()) return;
        out.addAll(Arrays.asList(text.split("\\R")));
    }

    private static String firstLine(String s) {
        int nl = s.indexOf('\n');
        return (nl < 0 ? s : s.substring(0, nl)).trim();
    }
}

/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.grammar;

import io.traceflow4j.core.api.model.ExceptionRecord;
import io.traceflow4j.core.api.model.GrammarId;
import io.traceflow4j.core.api.model.StackFrame;
import io.traceflow4j.core.tokenize.Span;
import io.traceflow4j.core.util.Timestamps;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * .NET unhandled exceptions:
 *
 * <pre>
 * Unhandled exception. System.InvalidOperationException: Sequence contains no elements
 *  ---&gt; System.ArgumentException: inner
 *    at Shop.Orders.OrderService.Load(Int32 id) in /src/Orders/OrderService.cs:line 42
 *    --- End of inner exception stack trace ---
 *    at Shop.Program.Main(String[] args) in /src/Program.cs:line 10
 * </pre>
 *
 * Frames without source information are skipped. Spans carrying JVM-style frames are left to
 * {@link JavaGrammar}. A span that does not start with {@code Unhandled exception} needs at least one
 * frame with source information.
 */
public final class CSharpGrammar implements Grammar {

    static final Pattern UNHANDLED = Pattern.compile("^Unhandled [eE]xception[.:]?\\s*(.*)$");
    static final Pattern EXCEPTION = Pattern.compile("^([A-Za-z_]\\w*(?:\\.[A-Za-z_`][\\w`]*)*\\.\\w*Exception):\\s?(.*)$");
    static final Pattern FRAME =
            Pattern.compile("^\\s+at\\s+(.+?)\\(([^)]*)\\)(?:\\s+in\\s+(.+?):line\\s+(\\d+))?\\s*$");
    static final Pattern FRAME_WITH_SOURCE = Pattern.compile("^\\s+at\\s+.+\\)\\s+in\\s+.+:line\\s+\\d+\\s*$");
    private static final Pattern INNER = Pattern.compile("^\\s*--->\\s+");
    private static final Pattern END_OF_TRACE = Pattern.compile("^\\s*--- End of .*---\\s*$");

    @Override
    public GrammarId id() {
        return GrammarId.CSHARP;
    }

    @Override
    public boolean isHeader(String line) {
        String l = Timestamps.strip(line);
        return UNHANDLED.matcher(l).matches() || EXCEPTION.matcher(l).matches();
    }

    @Override
    public boolean isContinuation(List<String> block, String line) {
        String l = Timestamps.strip(line);
        if (l.isBlank()) return false;
        if (block.size() == 1) {
            Matcher u = UNHANDLED.matcher(Timestamps.strip(block.get(0)));
            if (u.matches() && u.group(1).isEmpty() && EXCEPTION.matcher(l).matches()) return true;
        }
        return FRAME.matcher(l).matches() || INNER.matcher(l).find() || END_OF_TRACE.matcher(l).matches();
    }

    @Override
    public Optional<ExceptionRecord> parse(Span span) {
        List<String> lines = Frames.stripTimestamps(span.lines());
        if (!isHeader(lines.get(0))) return Optional.empty();
        for (String l : lines) {
            if (JavaGrammar.isJvmFrame(l)) return Optional.empty();
        }
        if (!UNHANDLED.matcher(lines.get(0)).matches() && !hasFrameWithSource(lines)) return Optional.empty();

        String type = null;
        String message = "";
        List<StackFrame> frames = new ArrayList<>();
        for (String l : lines) {
            if (type == null) {
                Matcher u = UNHANDLED.matcher(l);
                String candidate = u.matches() ? u.group(1) : l;
                Matcher e = EXCEPTION.matcher(candidate);
                if (e.matches()) {
                    type = e.group(1);
                    message = e.group(2).trim();
                    continue;
                }
            }
            Matcher f = FRAME.matcher(l);
            if (f.matches() && f.group(3) != null) {
                int n = Frames.parseLine(f.group(4));
                if (n >= 0) frames.add(new StackFrame(f.group(3), n, f.group(1)));
            }
        }
        return Optional.of(new ExceptionRecord(
                span.text(),
                id(),
                type == null ? "Unhandled exception" : type,
                message,
                frames,
                Timestamps.leading(span.first()).orElse(null),
                null));
    }

    private static boolean hasFrameWithSource(List<String> lines) {
        for (String l : lines) {
            if (FRAME_WITH_SOURCE.matcher(l).matches()) return true;
        }
        return false;
    }
}

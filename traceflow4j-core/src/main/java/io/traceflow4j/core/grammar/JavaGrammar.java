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
 * JVM stack traces as printed by {@code Throwable.printStackTrace} and logging frameworks:
 *
 * <pre>
 * Exception in thread "main" java.lang.IllegalStateException: boom
 * 	at com.acme.Foo.bar(Foo.java:42)
 * 	at com.acme.Main.main(Main.java:7)
 * Caused by: java.io.IOException: disk full
 * 	... 2 more
 * </pre>
 *
 * Only the top-level throwable's frames are kept; causes are part of the span but not of the frames.
 * A bare {@code pkg.Type: msg} header without the {@code Exception in thread} prefix only parses when
 * a JVM frame or a {@code Caused by:} line follows it, since Python and .NET print dotted exception
 * lines of the same shape.
 */
public final class JavaGrammar implements Grammar {

    static final Pattern HEADER = Pattern.compile("^(?:Exception in thread \"[^\"]*\" )?"
            + "((?:[a-zA-Z_$][\\w$]*\\.)+[\\w$]*(?:Exception|Error|Throwable))(?::\\s?(.*))?$");
    private static final Pattern FRAME = Pattern.compile("^\\s*at\\s+((?:[\\w$]+[./])*[\\w$<>]+)\\.([\\w$<>]+)"
            + "\\(([\\w$.\\-]+\\.(?:java|kt|kts|scala|groovy|clj)):(\\d+)\\)(?:\\s+~?\\[[^\\]]*\\])?\\s*$");
    private static final Pattern OPAQUE_FRAME =
            Pattern.compile("^\\s*at\\s+\\S+\\((?:Unknown Source|Native Method)\\)(?:\\s+~?\\[[^\\]]*\\])?\\s*$");
    private static final String THREAD_PREFIX = "Exception in thread ";
    private static final Pattern CAUSE = Pattern.compile("^\\s*(?:Caused by|Suppressed): ");
    private static final Pattern MORE = Pattern.compile("^\\s*\\.\\.\\. \\d+ (?:more|common frames omitted)\\s*$");

    @Override
    public GrammarId id() {
        return GrammarId.JAVA;
    }

    @Override
    public boolean isHeader(String line) {
        return HEADER.matcher(Timestamps.strip(line)).matches();
    }

    @Override
    public boolean isContinuation(List<String> block, String line) {
        String l = Timestamps.strip(line);
        return isJvmFrame(l) || CAUSE.matcher(l).find() || MORE.matcher(l).matches();
    }

    static boolean isJvmFrame(String stripped) {
        return FRAME.matcher(stripped).matches() || OPAQUE_FRAME.matcher(stripped).matches();
    }

    @Override
    public Optional<ExceptionRecord> parse(Span span) {
        List<String> lines = Frames.stripTimestamps(span.lines());
        Matcher h = HEADER.matcher(lines.get(0));
        if (!h.matches()) return Optional.empty();
        for (String l : lines) {
            if (CSharpGrammar.FRAME_WITH_SOURCE.matcher(l).matches()) return Optional.empty();
        }
        if (!lines.get(0).startsWith(THREAD_PREFIX) && !hasJvmEvidence(lines)) return Optional.empty();

        List<StackFrame> frames = new ArrayList<>();
        for (String l : lines.subList(1, lines.size())) {
            if (CAUSE.matcher(l).find()) break;
            Matcher f = FRAME.matcher(l);
            if (f.matches()) {
                int n = Frames.parseLine(f.group(4));
                if (n >= 0) frames.add(new StackFrame(f.group(3), n, f.group(1) + "." + f.group(2)));
            }
        }
        return Optional.of(new ExceptionRecord(
                span.text(),
                id(),
                h.group(1),
                h.group(2) == null ? "" : h.group(2).trim(),
                frames,
                Timestamps.leading(span.first()).orElse(null),
                null));
    }

    private static boolean hasJvmEvidence(List<String> lines) {
        for (String l : lines.subList(1, lines.size())) {
            if (isJvmFrame(l) || CAUSE.matcher(l).find()) return true;
        }
        return false;
    }
}

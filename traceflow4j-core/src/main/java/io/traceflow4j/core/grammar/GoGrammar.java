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
 * Go runtime panics and fatal errors:
 *
 * <pre>
 * panic: runtime error: invalid memory address or nil pointer dereference
 * [signal SIGSEGV: segmentation violation code=0x1 addr=0x0 pc=0x4a5b6c]
 *
 * goroutine 1 [running]:
 * main.(*Server).handle(0xc000010000, {0x6d2ec0, 0xc00001c030})
 * 	/src/handlers.go:69 +0x1d
 * main.main()
 * 	/src/main.go:12 +0x25
 * exit status 2
 * </pre>
 *
 * Frames come from the first goroutine only, which is the one that crashed.
 */
public final class GoGrammar implements Grammar {

    static final Pattern PANIC = Pattern.compile("^(panic|fatal error): ?(.*)$");
    static final Pattern GOROUTINE = Pattern.compile("^goroutine \\d+ \\[[^\\]]*\\]:\\s*$");
    private static final Pattern NESTED_PANIC = Pattern.compile("^\\s+panic: ");
    private static final Pattern SIGNAL = Pattern.compile("^\\[signal [^\\]]*\\]");
    private static final Pattern FUNCTION = Pattern.compile("^[\\w.\\-/%*()\\[\\]{}]+\\(.*\\)\\s*$");
    private static final Pattern CREATED_BY = Pattern.compile("^created by (\\S+)");
    private static final Pattern LOCATION = Pattern.compile("^\\s+(\\S+\\.go):(\\d+)(?:\\s+\\+0x[0-9a-fA-F]+)?\\s*$");
    private static final Pattern ELIDED = Pattern.compile("^\\.\\.\\.\\s*\\d*\\s*(?:additional )?frames elided\\.\\.\\.$");
    private static final Pattern EXIT = Pattern.compile("^exit status \\d+\\s*$");

    /** Parsed Go dump; {@code markerFound} is false when no panic/fatal line was present. */
    record Parsed(boolean markerFound, boolean goroutineFound, String type, String message, List<StackFrame> frames) {}

    @Override
    public GrammarId id() {
        return GrammarId.GO;
    }

    @Override
    public boolean isHeader(String line) {
        String l = Timestamps.strip(line);
        return PANIC.matcher(l).matches() || GOROUTINE.matcher(l).matches();
    }

    @Override
    public boolean isContinuation(List<String> block, String line) {
        String l = Timestamps.strip(line);
        if (l.isBlank()) {
            // single blank separators between the panic line and goroutine dumps
            return !Timestamps.strip(block.get(block.size() - 1)).isBlank();
        }
        return isStackLine(l);
    }

    /** Lines that can appear inside a dump after its header; {@code l} is timestamp-stripped. */
    static boolean isStackLine(String l) {
        return GOROUTINE.matcher(l).matches()
                || NESTED_PANIC.matcher(l).find()
                || SIGNAL.matcher(l).find()
                || LOCATION.matcher(l).matches()
                || CREATED_BY.matcher(l).find()
                || ELIDED.matcher(l).matches()
                || EXIT.matcher(l).matches()
                || (!Character.isWhitespace(l.charAt(0)) && FUNCTION.matcher(l).matches());
    }

    @Override
    public Optional<ExceptionRecord> parse(Span span) {
        List<String> lines = new ArrayList<>(span.lines().size());
        for (String l : span.lines()) lines.add(Timestamps.strip(l));
        if (!isHeader(lines.get(0))) return Optional.empty();
        Parsed p = parseDump(lines);
        return Optional.of(new ExceptionRecord(
                span.text(),
                id(),
                p.type(),
                p.message(),
                p.frames(),
                Timestamps.leading(span.first()).orElse(null),
                null));
    }

    static Parsed parseDump(List<String> lines) {
        String type = null;
        String message = "";
        boolean inGoroutine = false;
        boolean goroutineFound = false;
        String pendingFunction = null;
        List<StackFrame> frames = new ArrayList<>();

        for (String l : lines) {
            if (l.isBlank()) continue;
            Matcher panic = PANIC.matcher(l);
            if (type == null && panic.matches()) {
                type = panic.group(1);
                message = panic.group(2).trim();
                continue;
            }
            if (GOROUTINE.matcher(l).matches()) {
                if (goroutineFound) break; // only the crashing goroutine
                goroutineFound = true;
                inGoroutine = true;
                continue;
            }
            if (!inGoroutine) continue;

            Matcher loc = LOCATION.matcher(l);
            if (loc.matches()) {
                int n = Frames.parseLine(loc.group(2));
                if (n >= 0 && !isPanicMachinery(pendingFunction)) {
                    frames.add(new StackFrame(loc.group(1), n, pendingFunction));
                }
                pendingFunction = null;
                continue;
            }
            Matcher created = CREATED_BY.matcher(l);
            if (created.find()) {
                pendingFunction = created.group(1);
            } else if (!Character.isWhitespace(l.charAt(0)) && FUNCTION.matcher(l).matches()) {
                pendingFunction = functionName(l.trim());
            }
        }
        boolean marker = type != null;
        return new Parsed(marker, goroutineFound, marker ? type : "panic", message, frames);
    }

    /** Strips the trailing argument list: {@code main.(*S).h(0xc0, {0x1})} becomes {@code main.(*S).h}. */
    static String functionName(String call) {
        if (!call.endsWith(")")) return call;
        int depth = 0;
        for (int i = call.length() - 1; i >= 0; i--) {
            char c = call.charAt(i);
            if (c == ')') depth++;
            else if (c == '(') {
                depth--;
                if (depth == 0) return i == 0 ? call : call.substring(0, i);
            }
        }
        return call;
    }

    private static boolean isPanicMachinery(String function) {
        if (function == null) return false;
        return function.equals("panic")
                || function.equals("runtime.gopanic")
                || function.equals("runtime.sigpanic")
                || function.startsWith("runtime.panic");
    }
}

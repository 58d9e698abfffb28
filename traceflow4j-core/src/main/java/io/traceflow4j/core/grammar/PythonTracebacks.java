/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.grammar;

import io.traceflow4j.core.api.model.StackFrame;
import io.traceflow4j.core.util.Timestamps;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line rules shared by the Python-family grammars.
 *
 * <pre>
 * Traceback (most recent call last):
 *   File "app.py", line 10, in handler
 *     raise ValueError("bad input")
 * ValueError: bad input
 * </pre>
 *
 * A block ends after its unindented exception line unless a chaining sentence follows, in
 * which case the chained traceback is absorbed and its exception line becomes the final one.
 */
final class PythonTracebacks {

    static final Pattern HEADER = Pattern.compile("(?:Exception Group )?Traceback \\(most recent call last\\):\\s*$");
    static final Pattern FRAME = Pattern.compile("^\\s+File \"([^\"]+)\", line (\\d+)(?:, in (.+?))?\\s*$");
    static final Pattern CHAIN = Pattern.compile(
            "^\\s*(?:During handling of the above exception, another exception occurred:"
                    + "|The above exception was the direct cause of the following exception:)\\s*$");
    static final Pattern EXCEPTION = Pattern.compile("^([A-Za-z_][\\w.]*)(?::[ \\t]?(.*))?$");
    private static final Pattern CARETS = Pattern.compile("^\\s*[~^]+\\s*$");

    private PythonTracebacks() {}

    /** Parsed traceback body; {@code type} is null when the exception line was never reached. */
    record Parsed(boolean headerSeen, String type, String message, List<StackFrame> frames) {}

    static boolean isHeader(String stripped) {
        return HEADER.matcher(stripped).find();
    }

    static boolean isExceptionLine(String stripped) {
        return !stripped.isEmpty()
                && !Character.isWhitespace(stripped.charAt(0))
                && EXCEPTION.matcher(stripped).matches();
    }

    static boolean isContinuation(List<String> block, String line) {
        String l = Timestamps.strip(line);
        boolean blankTail = Timestamps.strip(block.get(block.size() - 1)).isBlank();
        String tail = lastNonBlank(block);

        if (CHAIN.matcher(tail).matches()) {
            return l.isBlank() || isHeader(l);
        }
        if (isExceptionLine(tail) && !isHeader(tail)) {
            if (l.isBlank()) return !blankTail;
            return CHAIN.matcher(l).matches();
        }
        if (l.isBlank()) return false;
        if (Character.isWhitespace(l.charAt(0))) return true; // frames, source lines, group markers
        if (CARETS.matcher(l).matches()) return true;
        return isExceptionLine(l) || CHAIN.matcher(l).matches();
    }

    /**
     * Parses timestamp-stripped lines starting at the first traceback header.
     * Frames come from the last chained traceback, innermost first.
     */
    static Parsed parse(List<String> stripped) {
        boolean headerSeen = false;
        String type = null;
        String message = null;
        List<StackFrame> frames = new ArrayList<>();
        for (String l : stripped) {
            if (isHeader(l)) {
                headerSeen = true;
                frames = new ArrayList<>();
                continue;
            }
            if (!headerSeen) continue;
            Matcher f = FRAME.matcher(l);
            if (f.matches()) {
                int line = Frames.parseLine(f.group(2));
                if (line >= 0) frames.add(new StackFrame(f.group(1), line, f.group(3)));
                continue;
            }
            if (CHAIN.matcher(l).matches()) continue;
            if (isExceptionLine(l)) {
                Matcher e = EXCEPTION.matcher(l);
                if (e.matches()) {
                    type = e.group(1);
                    message = e.group(2) == null ? "" : e.group(2).trim();
                }
            }
        }
        Collections.reverse(frames);
        return new Parsed(headerSeen, type, message, frames);
    }

    private static String lastNonBlank(List<String> block) {
        for (int i = block.size() - 1; i >= 0; i--) {
            String l = Timestamps.strip(block.get(i));
            if (!l.isBlank()) return l;
        }
        return "";
    }
}

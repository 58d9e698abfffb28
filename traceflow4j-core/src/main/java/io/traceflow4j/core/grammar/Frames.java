/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.grammar;

import io.traceflow4j.core.api.model.StackFrame;
import io.traceflow4j.core.util.Timestamps;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

final class Frames {

    private Frames() {}

    /** Line number from a digit run, or -1 if it does not fit an int. */
    static int parseLine(String digits) {
        if (digits == null || digits.isEmpty() || digits.length() > 9) return -1;
        return Integer.parseInt(digits);
    }

    static List<String> stripTimestamps(List<String> lines) {
        List<String> out = new ArrayList<>(lines.size());
        for (String l : lines) out.add(Timestamps.strip(l));
        return out;
    }

    static boolean anyFileContains(List<StackFrame> frames, String fragment) {
        for (StackFrame f : frames) {
            if (f.file().toLowerCase(Locale.ROOT).contains(fragment)) return true;
        }
        return false;
    }
}

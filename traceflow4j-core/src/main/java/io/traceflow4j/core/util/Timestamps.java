/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.util;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes the timestamp prefixes container runtimes and logging frameworks put in
 * front of each line:
 * <ul>
 *   <li>ISO-8601, {@code 2025-01-01T00:00:00.123456789Z}, {@code 2025-01-01 00:00:00,123+02:00}</li>
 *   <li>bracketed, {@code [2025-01-01 00:00:00]}</li>
 *   <li>day first, {@code 15-01-2024 10:30:45.123}</li>
 *   <li>syslog, {@code Jan  1 12:34:56}</li>
 * </ul>
 */
public final class Timestamps {

    private static final String ISO =
            "\\d{4}-\\d{2}-\\d{2}[T ]\\d{2}:\\d{2}:\\d{2}(?:[.,]\\d+)?(?:Z|[+-]\\d{2}:?\\d{2})?";
    private static final String BRACKETED = "\\[[^\\]\\n]{0,40}?\\d{2}:\\d{2}:\\d{2}[^\\]\\n]{0,20}]";
    private static final String DAY_FIRST = "\\d{2}-\\d{2}-\\d{4}[ T]\\d{2}:\\d{2}:\\d{2}(?:[.,]\\d+)?";
    private static final String SYSLOG = "(?:Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Oct|Nov|Dec) {1,2}\\d{1,2} \\d{2}:\\d{2}:\\d{2}";

    private static final Pattern PREFIX =
            Pattern.compile("^(" + ISO + "|" + BRACKETED + "|" + DAY_FIRST + "|" + SYSLOG + ")");

    private Timestamps() {}

    /** The timestamp the line starts with, if any. */
    public static Optional<String> leading(String line) {
        if (line == null || line.isEmpty()) return Optional.empty();
        Matcher m = PREFIX.matcher(line);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    /**
     * Length of the leading timestamp including one separating blank, or 0. Only one blank is
     * consumed so indentation that follows the timestamp survives.
     */
    public static int prefixLength(String line) {
        if (line == null || line.isEmpty()) return 0;
        Matcher m = PREFIX.matcher(line);
        if (!m.find()) return 0;
        int end = m.end();
        if (end < line.length() && (line.charAt(end) == ' ' || line.charAt(end) == '\t')) end++;
        return end;
    }

    /** The line without its leading timestamp (see {@link #prefixLength(String)}). */
    public static String strip(String line) {
        int n = prefixLength(line);
        return n == 0 ? line : line.substring(n);
    }
}

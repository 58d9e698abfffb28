/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.api.model;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Raw log text plus its ingestion mode, cut to the configured caps.
 * Truncation keeps whole lines only: the first line that would exceed either cap
 * is dropped together with everything after it.
 */
public final class LogStream {

    private final IngestionMode mode;
    private final List<String> lines;
    private final int totalLines;
    private final boolean truncated;

    private LogStream(IngestionMode mode, List<String> lines, int totalLines, boolean truncated) {
        this.mode = mode;
        this.lines = List.copyOf(lines);
        this.totalLines = totalLines;
        this.truncated = truncated;
    }

    public static LogStream of(String text, IngestionMode mode, Limits limits) {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(limits, "limits");
        if (text == null || text.isEmpty()) return new LogStream(mode, List.of(), 0, false);

        String[] physical = text.split("\\R", -1);
        int count = physical.length;
        // a trailing newline does not introduce another line
        if (count > 0 && physical[count - 1].isEmpty()) count--;

        List<String> kept = new ArrayList<>(Math.min(count, 1024));
        long bytes = 0;
        boolean truncated = false;
        for (int i = 0; i < count; i++) {
            if (limits.capsLines() && kept.size() >= limits.maxLines()) {
                truncated = true;
                break;
            }
            long lineBytes = physical[i].getBytes(StandardCharsets.UTF_8).length + 1L;
            if (limits.capsBytes() && bytes + lineBytes > limits.maxBytes()) {
                truncated = true;
                break;
            }
            bytes += lineBytes;
            kept.add(physical[i]);
        }
        return new LogStream(mode, kept, count, truncated);
    }

    public IngestionMode mode() {
        return mode;
    }

    /** Lines that survived the caps, in input order. */
    public List<String> lines() {
        return lines;
    }

    /** Number of physical lines in the input before capping. */
    public int totalLines() {
        return totalLines;
    }

    public boolean truncated() {
        return truncated;
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }
}

/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.api.model;

/**
 * Input caps applied before tokenizing. Values {@code <= 0} mean "no cap".
 */
public record Limits(int maxLines, long maxBytes) {

    public static final int DEFAULT_MAX_LINES = 50_000;
    public static final long DEFAULT_MAX_BYTES = 10L * 1024 * 1024;

    public static Limits defaults() {
        return new Limits(DEFAULT_MAX_LINES, DEFAULT_MAX_BYTES);
    }

    public static Limits unlimited() {
        return new Limits(0, 0);
    }

    public boolean capsLines() {
        return maxLines > 0;
    }

    public boolean capsBytes() {
        return maxBytes > 0;
    }
}

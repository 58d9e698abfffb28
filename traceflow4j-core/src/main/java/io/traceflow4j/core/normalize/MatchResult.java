/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.normalize;

import java.util.List;

public record MatchResult(boolean found, List<Match> matches) {
    public static MatchResult empty() {
        return new MatchResult(false, List.of());
    }

    /** Match indices [start,end), with the placeholder that replaces them. */
    public record Match(int start, int end, String type, String replacement) {}
}

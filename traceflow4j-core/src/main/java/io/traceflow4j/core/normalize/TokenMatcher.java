/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.normalize;

/** Stateless matcher that returns volatile spans (start..end) to replace. */
public interface TokenMatcher {
    MatchResult find(String line);
}

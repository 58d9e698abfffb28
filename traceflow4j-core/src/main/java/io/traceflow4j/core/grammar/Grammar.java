/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.grammar;

import io.traceflow4j.core.api.model.ExceptionRecord;
import io.traceflow4j.core.api.model.GrammarId;
import io.traceflow4j.core.tokenize.Span;
import java.util.List;
import java.util.Optional;

/**
 * Stateless recognizer for one ecosystem's exception format. All operations are total:
 * they answer {@code false} or empty for anything they do not understand.
 */
public interface Grammar {

    GrammarId id();

    /** Whether {@code line} can open a record. */
    boolean isHeader(String line);

    /**
     * Whether {@code line} still belongs to the record accumulated in {@code block}.
     * {@code block} is never empty and its first line satisfied {@link #isHeader(String)}.
     */
    boolean isContinuation(List<String> block, String line);

    /**
     * Extracts a record from the span. A span whose header matched but whose frames are missing
     * or malformed yields a record with no frames rather than empty.
     */
    Optional<ExceptionRecord> parse(Span span);
}

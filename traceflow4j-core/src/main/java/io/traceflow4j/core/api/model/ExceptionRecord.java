/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.api.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One extracted exception.
 *
 * @param raw       the span text the grammar matched
 * @param grammar   grammar that produced this record
 * @param type      exception type, e.g. {@code ValueError} or {@code panic}
 * @param message   exception message, possibly empty
 * @param frames    frames ordered innermost first; empty when the frames were malformed or missing
 * @param timestamp timestamp recovered from the raw text, "" when absent
 * @param endpoint  request path the log attributes the failure to, "" when absent
 */
public record ExceptionRecord(
        String raw,
        GrammarId grammar,
        String type,
        String message,
        List<StackFrame> frames,
        String timestamp,
        String endpoint) {

    public ExceptionRecord {
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(grammar, "grammar");
        type = type == null ? "" : type;
        message = message == null ? "" : message;
        frames = frames == null ? List.of() : List.copyOf(frames);
        timestamp = timestamp == null ? "" : timestamp;
        endpoint = endpoint == null ? "" : endpoint;
    }

    public Optional<StackFrame> firstFrame() {
        return frames.isEmpty() ? Optional.empty() : Optional.of(frames.get(0));
    }

    /** {@code Type: message}, or just the type when there is no message. */
    public String headline() {
        return message.isEmpty() ? type : type + ": " + message;
    }
}

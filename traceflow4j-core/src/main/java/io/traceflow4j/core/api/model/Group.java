/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.api.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Records sharing one normalized signature.
 *
 * @param signature      grouping key, never shown to users
 * @param count          number of member records
 * @param representative first-seen member
 * @param anchorFrame    first frame seen across members, nullable
 * @param firstSeenIndex position of the representative in the record list
 */
public record Group(
        String signature, int count, ExceptionRecord representative, StackFrame anchorFrame, int firstSeenIndex) {

    public Group {
        Objects.requireNonNull(signature, "signature");
        Objects.requireNonNull(representative, "representative");
    }

    public Optional<StackFrame> anchor() {
        return Optional.ofNullable(anchorFrame);
    }
}

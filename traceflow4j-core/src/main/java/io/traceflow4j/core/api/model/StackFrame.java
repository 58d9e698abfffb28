/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.api.model;

import java.util.Objects;

/** A single source location inside a stack trace; {@code function} may be null. */
public record StackFrame(String file, int line, String function) {

    public StackFrame {
        Objects.requireNonNull(file, "file");
    }

    public String location() {
        return file + ":" + line;
    }

    public String pretty() {
        return function == null ? location() : location() + " in " + function;
    }
}

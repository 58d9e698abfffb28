/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.api;

/**
 * Raised for caller or configuration mistakes (unknown grammar, unknown ingestion mode,
 * unusable substitution rule). Log content never causes this exception.
 */
public class InvalidControlInputException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidControlInputException(String message) {
        super(message);
    }

    public InvalidControlInputException(String message, Throwable cause) {
        super(message, cause);
    }
}

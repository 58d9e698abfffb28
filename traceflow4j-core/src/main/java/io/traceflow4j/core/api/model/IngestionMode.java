/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.api.model;

import io.traceflow4j.core.api.InvalidControlInputException;
import java.util.Locale;

/** How raw text is cut into candidate spans. */
public enum IngestionMode {
    SPLIT, // one record per physical line
    MULTILINE; // header line + continuation lines

    /**
     * Parses a caller-supplied mode name. Accepts the enum names and the
     * {@code split_input} / {@code multiline_log} aliases, ignoring case and dashes.
     */
    public static IngestionMode parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidControlInputException("Ingestion mode must not be empty; expected one of: split, multiline");
        }
        String v = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return switch (v) {
            case "split", "split_input" -> SPLIT;
            case "multiline", "multi_line", "multiline_log" -> MULTILINE;
            default -> throw new InvalidControlInputException(
                    "Unknown ingestion mode '" + value + "'; expected one of: split, multiline");
        };
    }
}

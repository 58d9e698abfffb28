/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.tokenize;

import io.traceflow4j.core.api.model.GrammarId;
import java.util.List;
import java.util.Objects;

/**
 * A candidate record: one or more consecutive physical lines.
 *
 * @param lines     raw lines, never empty
 * @param firstLine zero-based index of the first line in the capped stream
 * @param openedBy  grammars whose header and continuation rules accepted the whole span;
 *                  empty in split mode
 */
public record Span(List<String> lines, int firstLine, List<GrammarId> openedBy) {

    public Span {
        lines = List.copyOf(Objects.requireNonNull(lines, "lines"));
        if (lines.isEmpty()) throw new IllegalArgumentException("span must hold at least one line");
        openedBy = openedBy == null ? List.of() : List.copyOf(openedBy);
    }

    public static Span single(String line, int index) {
        return new Span(List.of(line), index, List.of());
    }

    public String first() {
        return lines.get(0);
    }

    public String text() {
        return String.join("\n", lines);
    }

    public int lastLine() {
        return firstLine + lines.size() - 1;
    }
}

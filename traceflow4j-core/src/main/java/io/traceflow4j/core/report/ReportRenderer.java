/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.report;

import io.traceflow4j.core.api.model.ExceptionRecord;
import io.traceflow4j.core.api.model.Group;
import io.traceflow4j.core.api.model.StackFrame;

/** Plain-text layout of a {@link Report}. Stateless; safe to share. */
public final class ReportRenderer {

    public static final String EMPTY_TEXT = "Stack trace report: no stack traces found";
    static final String TRUNCATED_TEXT =
            "WARNING: input exceeded the size cap and was truncated; counts cover the processed prefix only";

    private static final int DEFAULT_SNIPPET_LINES = 12;

    private final int snippetLines;

    public ReportRenderer() {
        this(DEFAULT_SNIPPET_LINES);
    }

    /** @param snippetLines raw lines shown per group; 0 or less hides snippets */
    public ReportRenderer(int snippetLines) {
        this.snippetLines = snippetLines;
    }

    public String render(Report report) {
        StringBuilder sb = new StringBuilder(256);
        if (report.isEmpty()) {
            sb.append(EMPTY_TEXT);
            if (report.truncated()) sb.append('\n').append(TRUNCATED_TEXT);
            return sb.toString();
        }

        sb.append("Stack trace report: ")
                .append(report.totalRecords()).append(" record(s) in ")
                .append(report.groups().size()).append(" group(s)");
        report.grammar().ifPresent(g -> sb.append(" (grammar: ").append(g.displayName()).append(')'));
        if (report.truncated()) sb.append('\n').append(TRUNCATED_TEXT);

        int rank = 1;
        for (Group g : report.groups()) {
            sb.append("\n\n");
            appendGroup(sb, rank++, g);
        }

        Group top = report.mostCommon().orElseThrow();
        sb.append("\n\nMost common: ").append(top.representative().headline());
        String anchor = report.anchor();
        if (!anchor.isEmpty()) sb.append(" at ").append(anchor);
        return sb.toString();
    }

    private void appendGroup(StringBuilder sb, int rank, Group g) {
        ExceptionRecord r = g.representative();
        sb.append('#').append(rank).append(" x").append(g.count()).append(' ').append(r.headline());
        sb.append("\n    grammar: ").append(r.grammar().displayName());
        sb.append(" | anchor: ").append(g.anchor().map(StackFrame::pretty).orElse("-"));
        if (!r.endpoint().isEmpty()) sb.append(" | endpoint: ").append(r.endpoint());
        if (!r.timestamp().isEmpty()) sb.append(" | first seen: ").append(r.timestamp());
        if (snippetLines <= 0) return;

        String[] lines = r.raw().split("\n", -1);
        int shown = Math.min(lines.length, snippetLines);
        for (int i = 0; i < shown; i++) {
            sb.append("\n    | ").append(lines[i]);
        }
        if (lines.length > shown) {
            sb.append("\n    | ... (").append(lines.length - shown).append(" more line(s))");
        }
    }
}

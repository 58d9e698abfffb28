/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.traceflow4j.core.api.model.GrammarId;
import io.traceflow4j.core.api.model.Group;
import io.traceflow4j.core.api.model.StackFrame;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Ranked groups of one analysis: count descending, ties by first-seen order.
 * Downstream ticketing reads {@link #mostCommon()} and {@link #anchor()}.
 */
public final class Report {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<Group> groups;
    private final int totalRecords;
    private final boolean truncated;
    private final GrammarId grammar;
    private final ReportRenderer renderer;

    public Report(List<Group> groups, boolean truncated, GrammarId grammar, ReportRenderer renderer) {
        this.groups = List.copyOf(Objects.requireNonNull(groups, "groups"));
        this.totalRecords = this.groups.stream().mapToInt(Group::count).sum();
        this.truncated = truncated;
        this.grammar = grammar;
        this.renderer = Objects.requireNonNull(renderer, "renderer");
    }

    public List<Group> groups() {
        return groups;
    }

    /** Sum of all group counts, equal to the number of extracted records. */
    public int totalRecords() {
        return totalRecords;
    }

    /** Input hit the size cap; counts cover the processed prefix only. */
    public boolean truncated() {
        return truncated;
    }

    /** Grammar the records came from, if any grammar matched. */
    public Optional<GrammarId> grammar() {
        return Optional.ofNullable(grammar);
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }

    public Optional<Group> mostCommon() {
        return groups.isEmpty() ? Optional.empty() : Optional.of(groups.get(0));
    }

    /** {@code file:line} of the most common group's anchor frame, or "" when there is none. */
    public String anchor() {
        return mostCommon().flatMap(Group::anchor).map(StackFrame::location).orElse("");
    }

    /**
     * Up to {@code depth} frames of the most common group's representative, starting at the anchor
     * frame, joined as {@code file:line, file:line}.
     */
    public String anchor(int depth) {
        if (depth <= 1) return anchor();
        Optional<Group> top = mostCommon();
        if (top.isEmpty() || top.get().anchor().isEmpty()) return "";
        List<StackFrame> frames = top.get().representative().frames();
        int from = Math.max(0, frames.indexOf(top.get().anchorFrame()));
        return frames.subList(from, Math.min(frames.size(), from + depth)).stream()
                .map(StackFrame::location)
                .collect(Collectors.joining(", "));
    }

    /** Human-readable summary. */
    public String render() {
        return renderer.render(this);
    }

    /** Plain map for the ticketing step: rendered report, most common stack trace, anchor. */
    public Map<String, Object> toData() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("report", render());
        m.put("most_common_stacktrace", mostCommon().map(g -> g.representative().raw()).orElse(""));
        m.put("anchor", anchor());
        m.put("truncated", truncated);
        m.put("total_records", totalRecords);
        m.put("grammar", grammar == null ? null : grammar.displayName());
        List<Map<String, Object>> gs = new ArrayList<>(groups.size());
        for (Group g : groups) {
            Map<String, Object> gm = new LinkedHashMap<>();
            gm.put("count", g.count());
            gm.put("type", g.representative().type());
            gm.put("message", g.representative().message());
            gm.put("anchor", g.anchor().map(StackFrame::location).orElse(""));
            gm.put("endpoint", g.representative().endpoint());
            gs.add(gm);
        }
        m.put("groups", gs);
        return m;
    }

    /** {@link #toData()} as a JSON object. */
    public String toJson() {
        try {
            return MAPPER.writeValueAsString(toData());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Report could not be serialized", e);
        }
    }
}

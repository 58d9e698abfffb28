/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;

/** Helpers for structured (one JSON object per line) log records. */
public final class JsonLogs {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonLogs() {}

    /**
     * A JSON log line.
     *
     * @param prefix text before the opening brace (usually a runtime timestamp), trimmed
     * @param node   the parsed object
     */
    public record JsonLine(String prefix, JsonNode node) {

        /** First non-blank textual value among {@code fields}; dotted names descend into objects. */
        public Optional<String> text(String... fields) {
            return JsonLogs.text(node, fields);
        }
    }

    /**
     * Parses a line holding a single JSON object, optionally preceded by a timestamp.
     * Anything that is not a JSON object yields empty.
     */
    public static Optional<JsonLine> parseLine(String line) {
        if (line == null) return Optional.empty();
        int brace = line.indexOf('{');
        if (brace < 0) return Optional.empty();
        String prefix = line.substring(0, brace).trim();
        if (!prefix.isEmpty() && Timestamps.leading(prefix).isEmpty()) return Optional.empty();
        String body = line.substring(brace).trim();
        if (!body.endsWith("}")) return Optional.empty();
        return readObject(body).map(n -> new JsonLine(prefix, n));
    }

    /** Parses {@code json} as an object; malformed input yields empty. */
    public static Optional<JsonNode> readObject(String json) {
        try {
            JsonNode node = MAPPER.readTree(json);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    public static Optional<String> text(JsonNode node, String... fields) {
        if (node == null) return Optional.empty();
        for (String f : fields) {
            JsonNode cur = node;
            for (String part : f.split("\\.")) {
                cur = cur == null ? null : cur.get(part);
            }
            if (cur != null && cur.isValueNode() && !cur.isNull()) {
                String s = cur.asText();
                if (!s.isBlank()) return Optional.of(s);
            }
        }
        return Optional.empty();
    }

    /**
     * Finds the first balanced {@code {...}} block.
     *
     * @return {@code [start, end)} or {@code [-1, -1]} when none closes
     */
    public static int[] balancedBraces(String s) {
        int depth = 0;
        int start = -1;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '{') {
                if (depth == 0) start = i;
                depth++;
            } else if (c == '}') {
                if (depth == 0) break; // stray closing brace
                depth--;
                if (depth == 0) return new int[] {start, i + 1};
            }
        }
        return new int[] {-1, -1};
    }
}

/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.tokenize;

import io.traceflow4j.core.api.model.GrammarId;
import io.traceflow4j.core.api.model.IngestionMode;
import io.traceflow4j.core.api.model.LogStream;
import io.traceflow4j.core.grammar.Grammar;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Cuts a {@link LogStream} into candidate spans.
 *
 * <p>The grammars in play are passed on every {@link SpanCursor#next(List)} call, so a caller can
 * narrow them mid-stream (the dynamic selector does once it has locked a grammar).
 */
public final class Tokenizer {

    public SpanCursor open(LogStream stream) {
        return new SpanCursor(Objects.requireNonNull(stream, "stream"));
    }

    /** Forward-only position in a stream. Not thread-safe; one cursor per analysis. */
    public static final class SpanCursor {
        private final LogStream stream;
        private final List<String> lines;
        private int pos;

        private SpanCursor(LogStream stream) {
            this.stream = stream;
            this.lines = stream.lines();
        }

        public boolean hasRemaining() {
            return pos < lines.size();
        }

        /**
         * Next span using {@code grammars}; they are ignored in split mode. Empty once the stream is
         * exhausted.
         */
        public Optional<Span> next(List<Grammar> grammars) {
            return stream.mode() == IngestionMode.SPLIT ? nextLine() : nextBlock(grammars);
        }

        private Optional<Span> nextLine() {
            while (pos < lines.size()) {
                int at = pos++;
                String line = lines.get(at);
                if (!line.isBlank()) return Optional.of(Span.single(line, at));
            }
            return Optional.empty();
        }

        private Optional<Span> nextBlock(List<Grammar> grammars) {
            while (pos < lines.size()) {
                int start = pos++;
                String line = lines.get(start);
                if (line.isBlank()) continue;

                List<Grammar> candidates = headersOf(grammars, line);
                if (candidates.isEmpty()) continue;

                List<String> block = new ArrayList<>();
                block.add(line);
                while (pos < lines.size()) {
                    String next = lines.get(pos);
                    List<Grammar> accepted = new ArrayList<>(candidates.size());
                    for (Grammar g : candidates) {
                        if (g.isContinuation(block, next)) accepted.add(g);
                    }
                    if (accepted.isEmpty()) break;
                    candidates = accepted;
                    block.add(next);
                    pos++;
                }
                while (block.size() > 1 && block.get(block.size() - 1).isBlank()) {
                    block.remove(block.size() - 1);
                }
                return Optional.of(new Span(block, start, ids(candidates)));
            }
            return Optional.empty();
        }

        private static List<Grammar> headersOf(List<Grammar> grammars, String line) {
            List<Grammar> out = new ArrayList<>(grammars.size());
            for (Grammar g : grammars) {
                if (g.isHeader(line)) out.add(g);
            }
            return out;
        }

        private static List<GrammarId> ids(List<Grammar> grammars) {
            List<GrammarId> out = new ArrayList<>(grammars.size());
            for (Grammar g : grammars) out.add(g.id());
            return out;
        }
    }
}

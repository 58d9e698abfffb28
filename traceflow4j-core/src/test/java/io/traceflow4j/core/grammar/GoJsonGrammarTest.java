/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.grammar;

import static org.assertj.core.api.Assertions.assertThat;

import io.traceflow4j.core.api.model.ExceptionRecord;
import io.traceflow4j.core.api.model.StackFrame;
import io.traceflow4j.core.tokenize.Span;
import java.util.List;
import org.junit.jupiter.api.Test;

class GoJsonGrammarTest {

    private final GoJsonGrammar grammar = new GoJsonGrammar();

    private static Span span(String... lines) {
        return new Span(List.of(lines), 0, List.of());
    }

    @Test
    void readsStackFromStacktraceField() {
        String line = "{\"level\":\"error\",\"ts\":\"2025-01-01T00:00:00Z\",\"msg\":\"panic recovered\","
                + "\"stacktrace\":\"goroutine 1 [running]:\\nmain.handler()\\n\\t/src/h.go:12 +0x1d\",\"path\":\"/v1/x\"}";

        assertThat(grammar.isHeader(line)).isTrue();
        ExceptionRecord r = grammar.parse(span(line)).orElseThrow();

        assertThat(r.type()).isEqualTo("panic");
        assertThat(r.message()).isEqualTo("panic recovered");
        assertThat(r.frames()).containsExactly(new StackFrame("/src/h.go", 12, "main.handler"));
        assertThat(r.timestamp()).isEqualTo("2025-01-01T00:00:00Z");
        assertThat(r.endpoint()).isEqualTo("/v1/x");
    }

    @Test
    void readsPanicFromMultiLineMessage() {
        String line = "{\"msg\":\"panic: index out of range [3] with length 3\\n\\ngoroutine 5 [running]:"
                + "\\nmain.get(...)\\n\\t/src/a.go:7 +0x2\"}";

        ExceptionRecord r = grammar.parse(span(line)).orElseThrow();

        assertThat(r.message()).isEqualTo("index out of range [3] with length 3");
        assertThat(r.frames()).containsExactly(new StackFrame("/src/a.go", 7, "main.get"));
    }

    @Test
    void absorbsRawStackLinesAfterTheRecord() {
        List<String> block = List.of("{\"msg\":\"panic: boom\"}");
        assertThat(grammar.isContinuation(block, "goroutine 1 [running]:")).isTrue();
        assertThat(grammar.isContinuation(block, "{\"msg\":\"panic: again\"}")).isFalse();
        assertThat(grammar.isContinuation(block, "")).isFalse();

        ExceptionRecord r = grammar.parse(span(
                        "{\"msg\":\"panic: boom\"}", "goroutine 1 [running]:", "main.main()", "\t/src/main.go:9 +0x1"))
                .orElseThrow();
        assertThat(r.frames()).containsExactly(new StackFrame("/src/main.go", 9, "main.main"));
    }

    @Test
    void ignoresRecordsThatAreNotPanics() {
        String line = "{\"msg\":\"request served\",\"note\":\"no panic here\"}";

        assertThat(grammar.isHeader(line)).isFalse();
        assertThat(grammar.parse(span(line))).isEmpty();
        assertThat(grammar.parse(span("panic: plain text"))).isEmpty();
    }
}

/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.grammar;

import static org.assertj.core.api.Assertions.assertThat;

import io.traceflow4j.core.api.model.ExceptionRecord;
import io.traceflow4j.core.api.model.GrammarId;
import io.traceflow4j.core.api.model.StackFrame;
import io.traceflow4j.core.tokenize.Span;
import java.util.List;
import org.junit.jupiter.api.Test;

class PythonGrammarTest {

    private final PythonGrammar grammar = new PythonGrammar();

    private static Span span(String... lines) {
        return new Span(List.of(lines), 0, List.of());
    }

    @Test
    void extractsTypeMessageAndFramesInnermostFirst() {
        ExceptionRecord r = grammar.parse(span(
                        "Traceback (most recent call last):",
                        "  File \"/app/main.py\", line 3, in <module>",
                        "    main()",
                        "  File \"/app/service.py\", line 42, in load",
                        "    raise KeyError(key)",
                        "KeyError: 'id'"))
                .orElseThrow();

        assertThat(r.grammar()).isEqualTo(GrammarId.PYTHON);
        assertThat(r.type()).isEqualTo("KeyError");
        assertThat(r.message()).isEqualTo("'id'");
        assertThat(r.frames())
                .containsExactly(
                        new StackFrame("/app/service.py", 42, "load"), new StackFrame("/app/main.py", 3, "<module>"));
    }

    @Test
    void chainedTracebackReportsTheFinalException() {
        ExceptionRecord r = grammar.parse(span(
                        "Traceback (most recent call last):",
                        "  File \"a.py\", line 1, in f",
                        "ValueError: first",
                        "",
                        "During handling of the above exception, another exception occurred:",
                        "",
                        "Traceback (most recent call last):",
                        "  File \"b.py\", line 2, in g",
                        "RuntimeError: second"))
                .orElseThrow();

        assertThat(r.type()).isEqualTo("RuntimeError");
        assertThat(r.message()).isEqualTo("second");
        assertThat(r.frames()).containsExactly(new StackFrame("b.py", 2, "g"));
    }

    @Test
    void headerWithoutFramesStillYieldsARecord() {
        ExceptionRecord r = grammar.parse(span("Traceback (most recent call last):", "  <frames lost>"))
                .orElseThrow();

        assertThat(r.type()).isEqualTo("Traceback");
        assertThat(r.frames()).isEmpty();
    }

    @Test
    void spanMustStartWithTheHeader() {
        assertThat(grammar.parse(span("ValueError: bad input"))).isEmpty();
        assertThat(grammar.parse(span("Internal Server Error: /x", "Traceback (most recent call last):")))
                .isEmpty();
    }

    @Test
    void readsTimestampOfTheFirstLine() {
        ExceptionRecord r = grammar.parse(span(
                        "2025-01-01T00:00:00Z Traceback (most recent call last):",
                        "2025-01-01T00:00:00Z   File \"app.py\", line 10, in handler",
                        "2025-01-01T00:00:00Z ValueError: bad input"))
                .orElseThrow();

        assertThat(r.timestamp()).isEqualTo("2025-01-01T00:00:00Z");
        assertThat(r.frames()).containsExactly(new StackFrame("app.py", 10, "handler"));
    }

    @Test
    void blockEndsAfterTheExceptionLine() {
        List<String> block = List.of(
                "Traceback (most recent call last):", "  File \"app.py\", line 10, in handler", "ValueError: bad");

        assertThat(grammar.isContinuation(block, "")).isTrue();
        assertThat(grammar.isContinuation(block, "INFO next request")).isFalse();
        assertThat(grammar.isContinuation(block, "Traceback (most recent call last):")).isFalse();
        assertThat(grammar.isContinuation(
                        block, "The above exception was the direct cause of the following exception:"))
                .isTrue();
    }

    @Test
    void caretAndSourceLinesContinue() {
        List<String> block = List.of("Traceback (most recent call last):", "  File \"app.py\", line 10, in handler");

        assertThat(grammar.isContinuation(block, "    return items[idx]")).isTrue();
        assertThat(grammar.isContinuation(block, "           ~~~~~^^^^^")).isTrue();
        assertThat(grammar.isContinuation(block, "")).isFalse();
    }
}

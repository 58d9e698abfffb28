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

class GoGrammarTest {

    private final GoGrammar grammar = new GoGrammar();

    private static Span span(String... lines) {
        return new Span(List.of(lines), 0, List.of());
    }

    @Test
    void parsesNilPointerPanic() {
        ExceptionRecord r = grammar.parse(span(
                        "panic: runtime error: invalid memory address or nil pointer dereference",
                        "[signal SIGSEGV: segmentation violation code=0x1 addr=0x0 pc=0x4a5b6c]",
                        "",
                        "goroutine 1 [running]:",
                        "main.(*Server).handle(0xc000010000, {0x6d2ec0, 0xc00001c030})",
                        "\t/src/handlers.go:69 +0x1d",
                        "main.main()",
                        "\t/src/main.go:12 +0x25",
                        "exit status 2"))
                .orElseThrow();

        assertThat(r.type()).isEqualTo("panic");
        assertThat(r.message()).isEqualTo("runtime error: invalid memory address or nil pointer dereference");
        assertThat(r.frames())
                .containsExactly(
                        new StackFrame("/src/handlers.go", 69, "main.(*Server).handle"),
                        new StackFrame("/src/main.go", 12, "main.main"));
    }

    @Test
    void keepsOnlyTheCrashingGoroutineAndSkipsPanicMachinery() {
        ExceptionRecord r = grammar.parse(span(
                        "panic: boom",
                        "",
                        "goroutine 7 [running]:",
                        "panic({0x4b2c40, 0xc000012345})",
                        "\t/usr/local/go/src/runtime/panic.go:914 +0x21f",
                        "main.worker(0x3)",
                        "\t/src/worker.go:21 +0x45",
                        "created by main.start in goroutine 1",
                        "\t/src/worker.go:10 +0x2a",
                        "",
                        "goroutine 1 [chan receive]:",
                        "main.main()",
                        "\t/src/main.go:30 +0x60"))
                .orElseThrow();

        assertThat(r.frames())
                .containsExactly(
                        new StackFrame("/src/worker.go", 21, "main.worker"),
                        new StackFrame("/src/worker.go", 10, "main.start"));
    }

    @Test
    void fatalErrorAndMarkerWithoutDump() {
        assertThat(grammar.parse(span("fatal error: concurrent map writes")).orElseThrow().type())
                .isEqualTo("fatal error");

        ExceptionRecord bare = grammar.parse(span("panic: oops")).orElseThrow();
        assertThat(bare.message()).isEqualTo("oops");
        assertThat(bare.frames()).isEmpty();
    }

    @Test
    void rejectsSpansWithoutAGoHeader() {
        assertThat(grammar.parse(span("Traceback (most recent call last):"))).isEmpty();
        assertThat(grammar.isHeader("goroutine 12 [select]:")).isTrue();
        assertThat(grammar.isHeader("panicking is not a panic")).isFalse();
    }

    @Test
    void singleBlankSeparatorsContinue() {
        assertThat(grammar.isContinuation(List.of("panic: boom"), "")).isTrue();
        assertThat(grammar.isContinuation(List.of("panic: boom", ""), "")).isFalse();
        assertThat(grammar.isContinuation(List.of("panic: boom", ""), "goroutine 1 [running]:")).isTrue();
        assertThat(grammar.isContinuation(List.of("panic: boom"), "INFO shutting down")).isFalse();
    }

    @Test
    void functionNameDropsArguments() {
        assertThat(GoGrammar.functionName("main.(*S).h(0xc0, {0x1, 0x2})")).isEqualTo("main.(*S).h");
        assertThat(GoGrammar.functionName("main.get(...)")).isEqualTo("main.get");
        assertThat(GoGrammar.functionName("main.main()")).isEqualTo("main.main");
    }
}

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

class CSharpGrammarTest {

    private final CSharpGrammar grammar = new CSharpGrammar();

    private static Span span(String... lines) {
        return new Span(List.of(lines), 0, List.of());
    }

    @Test
    void parsesUnhandledExceptionAndSkipsFramesWithoutSource() {
        ExceptionRecord r = grammar.parse(span(
                        "Unhandled exception. System.InvalidOperationException: Sequence contains no elements",
                        "   at System.Linq.ThrowHelper.ThrowNoElementsException()",
                        "   at Shop.Orders.OrderService.Load(Int32 id) in /src/Orders/OrderService.cs:line 42",
                        "   at Shop.Program.Main(String[] args) in /src/Program.cs:line 10"))
                .orElseThrow();

        assertThat(r.type()).isEqualTo("System.InvalidOperationException");
        assertThat(r.message()).isEqualTo("Sequence contains no elements");
        assertThat(r.frames())
                .containsExactly(
                        new StackFrame("/src/Orders/OrderService.cs", 42, "Shop.Orders.OrderService.Load"),
                        new StackFrame("/src/Program.cs", 10, "Shop.Program.Main"));
    }

    @Test
    void bareUnhandledLineTakesTheExceptionFromTheNextLine() {
        List<String> block = List.of("Unhandled exception.");
        assertThat(grammar.isContinuation(block, "System.Exception: boom")).isTrue();

        ExceptionRecord r = grammar.parse(span(
                        "Unhandled exception.",
                        "System.Exception: boom",
                        "   at App.Run() in C:\\src\\App.cs:line 7"))
                .orElseThrow();
        assertThat(r.type()).isEqualTo("System.Exception");
        assertThat(r.frames()).extracting(StackFrame::line).containsExactly(7);
    }

    @Test
    void innerExceptionMarkersContinue() {
        List<String> block = List.of("System.AggregateException: One or more errors occurred.");

        assertThat(grammar.isContinuation(block, " ---> System.ArgumentException: inner")).isTrue();
        assertThat(grammar.isContinuation(block, "   --- End of inner exception stack trace ---")).isTrue();
        assertThat(grammar.isContinuation(block, "info: Microsoft.Hosting.Lifetime[0]")).isFalse();
    }

    @Test
    void leavesJvmTracesAlone() {
        assertThat(grammar.parse(span("java.lang.IllegalStateException: boom", "\tat com.acme.Foo.bar(Foo.java:42)")))
                .isEmpty();
    }

    @Test
    void bareExceptionLineNeedsAFrameWithSource() {
        assertThat(grammar.parse(span("Shop.Orders.OrderNotFoundException: order 7"))).isEmpty();
        assertThat(grammar.parse(span(
                        "Shop.Orders.OrderNotFoundException: order 7",
                        "   at System.Linq.ThrowHelper.ThrowNoElementsException()")))
                .isEmpty();

        assertThat(grammar.parse(span("Unhandled exception. System.Exception: boom")))
                .map(ExceptionRecord::type)
                .contains("System.Exception");
    }
}

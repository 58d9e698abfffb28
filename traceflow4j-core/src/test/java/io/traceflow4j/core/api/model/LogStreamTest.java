/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.api.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class LogStreamTest {

    @Test
    void splitsOnAnyLineBreakAndIgnoresTrailingNewline() {
        LogStream s = LogStream.of("a\r\nb\nc\n", IngestionMode.SPLIT, Limits.defaults());

        assertThat(s.lines()).containsExactly("a", "b", "c");
        assertThat(s.totalLines()).isEqualTo(3);
        assertThat(s.truncated()).isFalse();
    }

    @Test
    void lineCapKeepsWholeLines() {
        LogStream s = LogStream.of("1\n2\n3\n4", IngestionMode.MULTILINE, new Limits(2, 0));

        assertThat(s.lines()).containsExactly("1", "2");
        assertThat(s.totalLines()).isEqualTo(4);
        assertThat(s.truncated()).isTrue();
    }

    @Test
    void byteCapCountsUtf8AndTheLineBreak() {
        // "é" is two bytes: "aé\n" = 4, "bb\n" = 3
        LogStream s = LogStream.of("aé\nbb\ncc", IngestionMode.MULTILINE, new Limits(0, 7));

        assertThat(s.lines()).containsExactly("aé", "bb");
        assertThat(s.truncated()).isTrue();
    }

    @Test
    void inputWithinCapsIsNotTruncated() {
        LogStream s = LogStream.of("aé\nbb", IngestionMode.MULTILINE, new Limits(2, 7));

        assertThat(s.lines()).hasSize(2);
        assertThat(s.truncated()).isFalse();
    }

    @Test
    void nullAndEmptyTextAreEmptyStreams() {
        assertThat(LogStream.of(null, IngestionMode.SPLIT, Limits.unlimited()).isEmpty()).isTrue();
        assertThat(LogStream.of("", IngestionMode.SPLIT, Limits.unlimited()).totalLines()).isZero();
    }
}

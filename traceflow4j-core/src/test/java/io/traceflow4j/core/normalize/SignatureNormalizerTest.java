/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.normalize;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.traceflow4j.core.api.InvalidControlInputException;
import io.traceflow4j.core.api.model.ExceptionRecord;
import io.traceflow4j.core.api.model.GrammarId;
import io.traceflow4j.core.api.model.StackFrame;
import java.util.List;
import org.junit.jupiter.api.Test;

class SignatureNormalizerTest {

    private final SignatureNormalizer defaults = SignatureNormalizer.defaults();

    @Test
    void timestampAndHexVariantsCollapse() {
        String a = defaults.normalize("2025-01-01T00:00:00Z order 0xdeadbeef failed");
        String b = defaults.normalize("2025-01-02T10:11:12.5Z  order 0xCAFEBABE1 failed");

        assertThat(a).isEqualTo("order <hex> failed").isEqualTo(b);
    }

    @Test
    void stackedTimestampPrefixesAreAllRemoved() {
        assertThat(defaults.normalize("2025-01-01T00:00:00.000000001Z [2025-01-01 00:00:00] boom"))
                .isEqualTo("boom");
    }

    @Test
    void hexRunsMustBeDelimited() {
        assertThat(defaults.normalize("session a1b2c3d4e5f6 closed")).isEqualTo("session <hex> closed");
        assertThat(defaults.normalize("handlerdeadbeefcafe")).isEqualTo("handlerdeadbeefcafe");
        assertThat(defaults.normalize("short abc12 id")).isEqualTo("short abc12 id");
    }

    @Test
    void rulesApplyInOrderAfterBuiltIns() {
        SignatureNormalizer n = new SignatureNormalizer(List.of(
                SubstitutionRule.of("user \\d+", "user <id>"), SubstitutionRule.literal("eu-west-1", "<region>")));

        assertThat(n.normalize("user 42 denied in eu-west-1")).isEqualTo("user <id> denied in <region>");
    }

    @Test
    void normalizeIsIdempotent() {
        SignatureNormalizer n = new SignatureNormalizer(List.of(SubstitutionRule.of("order \\d+", "order <n>")));
        List<String> samples = List.of(
                "2025-01-01T00:00:00Z Traceback (most recent call last):\n2025-01-01T00:00:00Z   File \"a.py\", line 1",
                "  order 17 lost at 0x7ffee3b2c9a0",
                "Jan  1 12:34:56 2025-01-01 10:00:00 nested",
                "",
                "plain");

        for (String s : samples) {
            String once = n.normalize(s);
            assertThat(n.normalize(once)).as(s).isEqualTo(once);
        }
    }

    @Test
    void normalizeIsIdempotentWhenPlaceholdersJoinTheirNeighbours() {
        SignatureNormalizer grows = new SignatureNormalizer(List.of(SubstitutionRule.of("Z", "abc")));
        String once = grows.normalize("abcZ");
        assertThat(once).isEqualTo("<hex>");
        assertThat(grows.normalize(once)).isEqualTo(once);

        SignatureNormalizer shrinks = new SignatureNormalizer(List.of(SubstitutionRule.of("ab", "a")));
        once = shrinks.normalize("abb");
        assertThat(once).isEqualTo("a");
        assertThat(shrinks.normalize(once)).isEqualTo(once);
    }

    @Test
    void rejectsRulesThatBreakIdempotence() {
        assertThatThrownBy(() -> new SignatureNormalizer(List.of(SubstitutionRule.of("\\d+", "<n1>"))))
                .isInstanceOf(InvalidControlInputException.class)
                .hasMessageContaining("<n1>");
        assertThatThrownBy(() -> new SignatureNormalizer(List.of(SubstitutionRule.of("token", "deadbeef"))))
                .isInstanceOf(InvalidControlInputException.class);
    }

    @Test
    void rejectsMalformedPatterns() {
        assertThatThrownBy(() -> new SignatureNormalizer(List.of(SubstitutionRule.of("([a-z", "<x>"))))
                .isInstanceOf(InvalidControlInputException.class)
                .hasMessageContaining("([a-z");
        assertThatThrownBy(() -> SubstitutionRule.of("", "<x>")).isInstanceOf(InvalidControlInputException.class);
    }

    @Test
    void signatureIgnoresTimestampAndRawText() {
        List<StackFrame> frames = List.of(new StackFrame("app.py", 10, "handler"));
        ExceptionRecord a = new ExceptionRecord("raw a", GrammarId.PYTHON, "ValueError", "bad input", frames, "t1", null);
        ExceptionRecord b = new ExceptionRecord("raw b", GrammarId.PYTHON, "ValueError", "bad input", frames, "t2", "/x");
        ExceptionRecord c = new ExceptionRecord("raw a", GrammarId.DJANGO, "ValueError", "bad input", frames, "t1", null);

        assertThat(defaults.signatureOf(a)).isEqualTo(defaults.signatureOf(b)).isNotEqualTo(defaults.signatureOf(c));
        assertThat(defaults.signatureOf(a)).isEqualTo("PYTHON\nValueError: bad input\n  at app.py:10 in handler");
    }
}

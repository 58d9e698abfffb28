/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.grammar;

import static org.assertj.core.api.Assertions.assertThat;

import io.traceflow4j.core.api.model.GrammarId;
import org.junit.jupiter.api.Test;

class GrammarRegistryTest {

    private final GrammarRegistry registry = new GrammarRegistry();

    @Test
    void hasOneGrammarPerId() {
        for (GrammarId id : GrammarId.values()) {
            assertThat(registry.get(id).id()).isEqualTo(id);
        }
    }

    @Test
    void triesStructuredFormatsFirst() {
        assertThat(registry.inPriorityOrder())
                .extracting(Grammar::id)
                .containsExactly(
                        GrammarId.GO_JSON,
                        GrammarId.DJANGO_JSON,
                        GrammarId.PYTHON,
                        GrammarId.DJANGO,
                        GrammarId.GO,
                        GrammarId.JAVA,
                        GrammarId.CSHARP);
        assertThat(GrammarRegistry.priority()).containsExactlyInAnyOrder(GrammarId.values());
    }
}

/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.select;

import io.traceflow4j.core.api.model.ExceptionRecord;
import io.traceflow4j.core.api.model.GrammarId;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of grammar selection over one stream.
 *
 * @param lockedGrammar grammar applied to the stream; the explicit one, the one dynamic probing
 *                      locked onto, or null when probing found nothing
 * @param records       extracted records in stream order
 * @param trace         probe decisions, filled only when tracing was requested
 */
public record Selection(GrammarId lockedGrammar, List<ExceptionRecord> records, List<String> trace) {

    public Selection {
        records = List.copyOf(records);
        trace = trace == null ? List.of() : List.copyOf(trace);
    }

    public Optional<GrammarId> locked() {
        return Optional.ofNullable(lockedGrammar);
    }
}

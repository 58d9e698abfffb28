/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.grammar;

import io.traceflow4j.core.api.model.GrammarId;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fixed set of built-in grammars.
 *
 * <h3>Dynamic probing order</h3>
 * <ul>
 *   <li><b>1.</b> Structured records ({@code GO_JSON}, {@code DJANGO_JSON}): a JSON line is never
 *       mistaken for plain text by them</li>
 *   <li><b>2.</b> Python family ({@code PYTHON} before {@code DJANGO}, so a bare traceback stays Python)</li>
 *   <li><b>3.</b> {@code GO}</li>
 *   <li><b>4.</b> {@code JAVA} before {@code CSHARP}: .NET crashes carry their own
 *       {@code Unhandled exception.} marker, a bare {@code pkg.FooException: msg} line does not</li>
 * </ul>
 */
public final class GrammarRegistry {

    private static final List<GrammarId> PRIORITY = List.of(
            GrammarId.GO_JSON,
            GrammarId.DJANGO_JSON,
            GrammarId.PYTHON,
            GrammarId.DJANGO,
            GrammarId.GO,
            GrammarId.JAVA,
            GrammarId.CSHARP);

    private final Map<GrammarId, Grammar> grammars = new EnumMap<>(GrammarId.class);
    private final List<Grammar> ordered;

    public GrammarRegistry() {
        for (GrammarId id : GrammarId.values()) grammars.put(id, create(id));
        List<Grammar> out = new ArrayList<>(PRIORITY.size());
        for (GrammarId id : PRIORITY) out.add(grammars.get(id));
        this.ordered = List.copyOf(out);
    }

    private static Grammar create(GrammarId id) {
        return switch (id) {
            case GO -> new GoGrammar();
            case GO_JSON -> new GoJsonGrammar();
            case PYTHON -> new PythonGrammar();
            case DJANGO -> new DjangoGrammar();
            case DJANGO_JSON -> new DjangoJsonGrammar();
            case CSHARP -> new CSharpGrammar();
            case JAVA -> new JavaGrammar();
        };
    }

    public Grammar get(GrammarId id) {
        return grammars.get(Objects.requireNonNull(id, "id"));
    }

    /** All grammars in dynamic probing order. */
    public List<Grammar> inPriorityOrder() {
        return ordered;
    }

    public static List<GrammarId> priority() {
        return PRIORITY;
    }
}

/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.core.api.model;

import io.traceflow4j.core.api.InvalidControlInputException;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/** Closed set of built-in grammars. Adding one forces every switch over it to be updated. */
public enum GrammarId {
    GO("GoLang"),
    GO_JSON("GoLangJson"),
    PYTHON("Python"),
    DJANGO("Django"),
    DJANGO_JSON("DjangoJson"),
    CSHARP("CSharp"),
    JAVA("Java");

    private final String displayName;

    GrammarId(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /** Resolves an enum name or display name, case-insensitively. */
    public static GrammarId parse(String name) {
        if (name != null) {
            String key = normalizeKey(name);
            for (GrammarId id : values()) {
                if (normalizeKey(id.name()).equals(key) || normalizeKey(id.displayName).equals(key)) return id;
            }
        }
        throw new InvalidControlInputException(
                "Unknown grammar '" + name + "'; expected 'dynamic' or one of: " + knownNames());
    }

    static String knownNames() {
        return Arrays.stream(values()).map(GrammarId::displayName).collect(Collectors.joining(", "));
    }

    private static String normalizeKey(String s) {
        return s.trim().toLowerCase(Locale.ROOT).replaceAll("[-_\\s]", "");
    }
}

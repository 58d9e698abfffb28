/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.spring;

import io.traceflow4j.core.api.model.GrammarSelection;
import io.traceflow4j.core.api.model.Limits;
import java.util.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "traceflow4j")
public class TraceflowProperties {

    private boolean enabled = true;

    /** split, multiline (aliases: split_input, multiline_log). */
    private String mode = "multiline";

    /** "dynamic" or a grammar name such as GoLangJson or Python. */
    private String grammar = GrammarSelection.DYNAMIC_NAME;

    /** Record grammar probe decisions and log them at INFO. */
    private boolean debug = false;

    private int maxLines = Limits.DEFAULT_MAX_LINES;
    private long maxBytes = Limits.DEFAULT_MAX_BYTES;

    /** Frames joined into the anchor of recent-report summaries. */
    private int anchorDepth = 1;

    /** Raw lines of each group's representative shown in rendered reports. */
    private int snippetLines = 12;

    /** Recent report summaries kept for the actuator endpoint. */
    private int recentCapacity = 50;

    /** Path fragments whose frames never become a group's anchor; installed libraries by default. */
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private List<String> hidePaths = new ArrayList<>(List.of("site-packages"));

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private List<Substitution> substitutions = new ArrayList<>();

    public List<String> getHidePaths() {
        return Collections.unmodifiableList(hidePaths);
    }

    public void setHidePaths(List<String> v) {
        this.hidePaths = new ArrayList<>(Objects.requireNonNullElse(v, List.of()));
    }

    public List<Substitution> getSubstitutions() {
        return Collections.unmodifiableList(substitutions);
    }

    public void setSubstitutions(List<Substitution> v) {
        this.substitutions = new ArrayList<>(Objects.requireNonNullElse(v, List.of()));
    }

    public Limits limits() {
        return new Limits(maxLines, maxBytes);
    }

    // ---- nested: substitutions[] ----
    @Getter
    @Setter
    public static final class Substitution {
        private String pattern;
        private String replacement = "<var>";
    }
}

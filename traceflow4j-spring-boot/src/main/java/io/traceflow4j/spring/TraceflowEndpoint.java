/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.spring;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;

/** {@code /actuator/traceflow}: active configuration and the latest analyses. */
@Endpoint(id = "traceflow")
public class TraceflowEndpoint {

    private final MicrometerAnalysisObserver observer;
    private final TraceflowProperties props;

    public TraceflowEndpoint(MicrometerAnalysisObserver observer, TraceflowProperties props) {
        this.observer = observer;
        this.props = props;
    }

    @ReadOperation
    public Map<String, Object> info() {
        Map<String, Object> m = new HashMap<>();
        m.put("status", "OK");
        m.put("mode", props.getMode());
        m.put("grammar", props.getGrammar());
        m.put("limits", Map.of("maxLines", props.getMaxLines(), "maxBytes", props.getMaxBytes()));
        m.put("hidePaths", props.getHidePaths());

        List<MicrometerAnalysisObserver.Summary> recent = observer.recentReports();
        m.put("lastAnchor", recent.isEmpty() ? "" : recent.get(recent.size() - 1).anchor());
        m.put("recentReports", recent);
        return m;
    }
}

/*
 * Copyright (c) 2025 Traceflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.traceflow4j.spring;

import io.micrometer.core.instrument.MeterRegistry;
import io.traceflow4j.core.api.TraceAnalyzer;
import io.traceflow4j.core.normalize.SubstitutionRule;
import io.traceflow4j.core.report.AnalysisObserver;
import io.traceflow4j.core.report.NoopAnalysisObserver;
import io.traceflow4j.core.report.ReportRenderer;
import io.traceflow4j.core.report.Reporter;
import java.util.List;
import org.springframework.boot.actuate.autoconfigure.endpoint.condition.ConditionalOnAvailableEndpoint;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.*;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the analyzer from {@code traceflow4j.*} properties. Metrics and the actuator endpoint
 * are added only when Micrometer (and actuator) are on the classpath.
 */
@AutoConfiguration(
        afterName = {
            "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
            "org.springframework.boot.actuate.autoconfigure.metrics.export.simple.SimpleMetricsExportAutoConfiguration"
        })
@EnableConfigurationProperties(TraceflowProperties.class)
@ConditionalOnProperty(prefix = "traceflow4j", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TraceflowAutoConfiguration {

    /** Fallback when Micrometer is absent; the metrics observer below is registered first. */
    @Bean
    @ConditionalOnMissingBean(AnalysisObserver.class)
    public AnalysisObserver traceflowAnalysisObserver() {
        return new NoopAnalysisObserver();
    }

    @Bean
    @ConditionalOnMissingBean
    public TraceAnalyzer traceAnalyzer(TraceflowProperties props, AnalysisObserver observer) {
        List<SubstitutionRule> rules = props.getSubstitutions().stream()
                .map(s -> SubstitutionRule.of(s.getPattern(), s.getReplacement()))
                .toList();
        return new TraceAnalyzer(
                rules, props.getHidePaths(), new Reporter(new ReportRenderer(props.getSnippetLines())), observer);
    }

    @Bean
    @ConditionalOnMissingBean
    public TraceflowService traceflowService(TraceAnalyzer analyzer, TraceflowProperties props) {
        return new TraceflowService(analyzer, props);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        @ConditionalOnMissingBean
        public MicrometerAnalysisObserver micrometerAnalysisObserver(MeterRegistry registry, TraceflowProperties props) {
            return new MicrometerAnalysisObserver(registry, props.getRecentCapacity(), props.getAnchorDepth());
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(
            name = {
                "io.micrometer.core.instrument.MeterRegistry",
                "org.springframework.boot.actuate.autoconfigure.endpoint.condition.ConditionalOnAvailableEndpoint"
            })
    static class EndpointConfiguration {

        @Bean
        @ConditionalOnBean(type = "io.micrometer.core.instrument.MeterRegistry")
        @ConditionalOnAvailableEndpoint(endpoint = TraceflowEndpoint.class)
        public TraceflowEndpoint traceflowEndpoint(MicrometerAnalysisObserver observer, TraceflowProperties props) {
            return new TraceflowEndpoint(observer, props);
        }
    }
}

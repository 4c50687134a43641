package com.billing.benchmark.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger activeOverrides;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.activeOverrides = registry.gauge("overrides.active", new AtomicInteger(0));
    }

    public void recordRecompute(String benchmark, int lineCount, int groupCount) {
        Counter.builder("analysis.recompute.count")
                .tag("benchmark", benchmark)
                .register(registry)
                .increment();

        DistributionSummary.builder("analysis.lines")
                .register(registry)
                .record(lineCount);

        DistributionSummary.builder("analysis.groups")
                .register(registry)
                .record(groupCount);
    }

    public void recordFlagged(String status, long count) {
        Counter.builder("analysis.flagged.count")
                .tag("status", status)
                .register(registry)
                .increment(count);
    }

    public void recordOverrideChange(String action) {
        Counter.builder("overrides.changed.count")
                .tag("action", action)
                .register(registry)
                .increment();
    }

    public void updateActiveOverrides(int count) {
        activeOverrides.set(count);
    }
}

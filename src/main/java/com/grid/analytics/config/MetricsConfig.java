package com.grid.analytics.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicLong observedContaminationPpm;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.observedContaminationPpm = new AtomicLong(0);
        registry.gauge("pipeline.anomaly.observed_contamination", observedContaminationPpm,
                value -> value.get() / 1_000_000.0);
    }

    public void recordStageOutcome(String stage, String outcome) {
        Counter.builder("pipeline.stage.count")
                .tag("stage", stage)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordRun(String status, Duration duration) {
        Timer.builder("pipeline.run.duration")
                .tag("status", status)
                .register(registry)
                .record(duration);
    }

    public void recordModelRmse(String algorithm, double rmse) {
        DistributionSummary.builder("pipeline.model.rmse")
                .tag("algorithm", algorithm)
                .register(registry)
                .record(rmse);
    }

    public void updateObservedContamination(double fraction) {
        observedContaminationPpm.set(Math.round(fraction * 1_000_000));
    }
}

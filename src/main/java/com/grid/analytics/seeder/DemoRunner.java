package com.grid.analytics.seeder;

import com.grid.analytics.model.PipelineConfig;
import com.grid.analytics.model.PipelineRun;
import com.grid.analytics.model.RawRecord;
import com.grid.analytics.service.PipelineOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Runs the pipeline once over synthetic data at startup so the read endpoints have a bundle to serve.
 * Only runs when the "demo" Spring profile is active.
 *
 * Run with:  mvn spring-boot:run -Dspring-boot.run.profiles=demo
 */
@Component
@Profile("demo")
public class DemoRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DemoRunner.class);

    private static final int HOURS = 24 * 60;

    private final PipelineOrchestrator orchestrator;

    public DemoRunner(PipelineOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run(String... args) {
        log.info("=== Generating {} hours of synthetic grid data ===", HOURS);
        List<RawRecord> records = new GridDataGenerator(42)
                .generate(Instant.parse("2024-01-01T00:00:00Z"), HOURS, 0.02);

        PipelineRun run = orchestrator.run(records, PipelineConfig.builder()
                .clusterCount(4)
                .contaminationRate(0.02)
                .build());

        log.info("=== Demo run {} finished: {} ===", run.getRunId(), run.getStatusLine());
    }
}

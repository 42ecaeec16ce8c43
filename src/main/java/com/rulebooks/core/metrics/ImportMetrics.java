package com.rulebooks.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for project imports.
 */
@Service
public class ImportMetrics {

    private final MeterRegistry registry;

    public ImportMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordImportDuration(long ms) {
        Timer.builder("rulebooks.import.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param result {@code success} or the simple name of the failure's exception class
     */
    public void recordImportResult(String result) {
        Counter.builder("rulebooks.imports.total")
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void recordRulebooks(int rulebooks, int rulesets, int rules) {
        Counter.builder("rulebooks.import.rulebooks")
                .register(registry)
                .increment(rulebooks);
        Counter.builder("rulebooks.import.rulesets")
                .register(registry)
                .increment(rulesets);
        Counter.builder("rulebooks.import.rules")
                .register(registry)
                .increment(rules);
    }
}

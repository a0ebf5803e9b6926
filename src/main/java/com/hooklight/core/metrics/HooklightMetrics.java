package com.hooklight.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for subagent lifecycle tracking.
 */
@Service
public class HooklightMetrics {

    private final MeterRegistry registry;

    public HooklightMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSpawn(String agentType) {
        Counter.builder("hooklight.subagent.spawns")
                .tag("agent_type", agentType)
                .register(registry)
                .increment();
    }

    public void recordCompletion(String agentType, String status, long durationMs) {
        Timer.builder("hooklight.subagent.duration")
                .description("Wall-clock time from spawn to stop of correlated subagents")
                .tag("agent_type", agentType)
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    /**
     * Records a stop event that had no matching start.
     */
    public void recordOrphanedStop(String agentType) {
        Counter.builder("hooklight.subagent.orphaned_stops")
                .tag("agent_type", agentType)
                .register(registry)
                .increment();
    }

    public void recordStaleEvictions(int count) {
        Counter.builder("hooklight.registry.stale_evictions")
                .description("Registry entries evicted for never reporting completion")
                .register(registry)
                .increment(count);
    }

    public void recordFilesModified(int count) {
        DistributionSummary.builder("hooklight.subagent.files_modified")
                .register(registry)
                .record(count);
    }

    public void recordTelemetryFailure() {
        Counter.builder("hooklight.telemetry.write_failures")
                .register(registry)
                .increment();
    }
}

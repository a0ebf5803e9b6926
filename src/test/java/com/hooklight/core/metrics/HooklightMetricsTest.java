package com.hooklight.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class HooklightMetricsTest {

    private SimpleMeterRegistry registry;
    private HooklightMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new HooklightMetrics(registry);
    }

    @Test
    @DisplayName("recordSpawn increments by agent type")
    void recordSpawn() {
        metrics.recordSpawn("backend-engineer");
        metrics.recordSpawn("backend-engineer");
        metrics.recordSpawn("test-engineer");

        var backend = registry.find("hooklight.subagent.spawns").tag("agent_type", "backend-engineer").counter();
        var tester = registry.find("hooklight.subagent.spawns").tag("agent_type", "test-engineer").counter();
        assertNotNull(backend);
        assertNotNull(tester);
        assertEquals(2.0, backend.count());
        assertEquals(1.0, tester.count());
    }

    @Test
    @DisplayName("recordCompletion records duration by type and status")
    void recordCompletion() {
        metrics.recordCompletion("backend-engineer", "completed", 1500);
        metrics.recordCompletion("backend-engineer", "failed", 500);

        var completed = registry.find("hooklight.subagent.duration")
                .tag("agent_type", "backend-engineer").tag("status", "completed").timer();
        assertNotNull(completed);
        assertEquals(1, completed.count());
        assertEquals(1500.0, completed.totalTime(TimeUnit.MILLISECONDS));
        assertNotNull(registry.find("hooklight.subagent.duration").tag("status", "failed").timer());
    }

    @Test
    @DisplayName("recordOrphanedStop increments by agent type")
    void recordOrphanedStop() {
        metrics.recordOrphanedStop("unknown");
        var counter = registry.find("hooklight.subagent.orphaned_stops").tag("agent_type", "unknown").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("recordStaleEvictions adds the evicted count")
    void recordStaleEvictions() {
        metrics.recordStaleEvictions(3);
        metrics.recordStaleEvictions(2);
        assertEquals(5.0, registry.find("hooklight.registry.stale_evictions").counter().count());
    }

    @Test
    @DisplayName("recordFilesModified records to distribution summary")
    void recordFilesModified() {
        metrics.recordFilesModified(4);
        metrics.recordFilesModified(0);
        var summary = registry.find("hooklight.subagent.files_modified").summary();
        assertNotNull(summary);
        assertEquals(2, summary.count());
        assertEquals(4.0, summary.totalAmount());
    }

    @Test
    @DisplayName("recordTelemetryFailure increments counter")
    void recordTelemetryFailure() {
        metrics.recordTelemetryFailure();
        assertEquals(1.0, registry.find("hooklight.telemetry.write_failures").counter().count());
    }
}

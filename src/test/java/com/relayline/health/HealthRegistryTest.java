package com.relayline.health;

import com.relayline.provider.HealthCheckResult;
import com.relayline.provider.ProviderId;
import com.relayline.testutil.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HealthRegistryTest {

    private final MutableClock clock = MutableClock.startingAt("2025-01-15T10:00:00Z");

    @Test
    void hasRecordForEveryProvider() {
        HealthRegistry registry = new HealthRegistry(EnumSet.of(ProviderId.GROQ), 1, clock);

        List<ProviderHealthSnapshot> snapshot = registry.snapshot();

        assertEquals(ProviderId.values().length, snapshot.size());
        for (ProviderId id : ProviderId.values()) {
            assertNotNull(registry.get(id));
            assertEquals(id.getTier(), registry.get(id).getTier());
        }
    }

    @Test
    void unconfiguredProviderStaysUnhealthy() {
        HealthRegistry registry = new HealthRegistry(EnumSet.of(ProviderId.GROQ), 1, clock);

        registry.recordSuccess(ProviderId.GEMINI, 10);

        assertTrue(registry.isHealthy(ProviderId.GROQ));
        assertFalse(registry.isHealthy(ProviderId.GEMINI));
        assertFalse(registry.isConfigured(ProviderId.GEMINI));
        assertEquals(EnumSet.of(ProviderId.GROQ), registry.healthyIds());
    }

    @Test
    void singleFailureMarksUnhealthyByDefault() {
        HealthRegistry registry = new HealthRegistry(EnumSet.allOf(ProviderId.class), 1, clock);

        assertTrue(registry.recordFailure(ProviderId.GROQ, "503"));
        assertFalse(registry.recordFailure(ProviderId.GROQ, "503"));

        assertFalse(registry.isHealthy(ProviderId.GROQ));
        assertEquals("503", registry.get(ProviderId.GROQ).getLastError());
        assertEquals(clock.instant(), registry.get(ProviderId.GROQ).getLastCheck());
    }

    @Test
    void thresholdCountsConsecutiveFailures() {
        HealthRegistry registry = new HealthRegistry(EnumSet.allOf(ProviderId.class), 3, clock);

        registry.recordFailure(ProviderId.CEREBRAS, "timeout");
        registry.recordFailure(ProviderId.CEREBRAS, "timeout");
        assertTrue(registry.isHealthy(ProviderId.CEREBRAS));

        registry.recordSuccess(ProviderId.CEREBRAS, 120);
        registry.recordFailure(ProviderId.CEREBRAS, "timeout");
        registry.recordFailure(ProviderId.CEREBRAS, "timeout");
        assertTrue(registry.isHealthy(ProviderId.CEREBRAS));

        registry.recordFailure(ProviderId.CEREBRAS, "timeout");
        assertFalse(registry.isHealthy(ProviderId.CEREBRAS));
    }

    @Test
    void probeResultUpdatesLatencyAndTimestamp() {
        HealthRegistry registry = new HealthRegistry(EnumSet.allOf(ProviderId.class), 1, clock);
        registry.markUnhealthy(ProviderId.MISTRAL, "down");
        clock.advance(Duration.ofMinutes(5));

        registry.recordProbe(ProviderId.MISTRAL, HealthCheckResult.healthy(87));

        ProviderHealthSnapshot snapshot = registry.get(ProviderId.MISTRAL).snapshot();
        assertTrue(snapshot.isHealthy());
        assertEquals(87, snapshot.getResponseTimeMs());
        assertEquals(clock.instant(), snapshot.getLastCheck());
        assertEquals(0, snapshot.getConsecutiveFailures());
        assertNull(snapshot.getLastError());
    }
}

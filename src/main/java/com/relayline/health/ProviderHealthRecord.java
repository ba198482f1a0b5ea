package com.relayline.health;

import com.relayline.provider.ProviderId;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Mutable health record for one provider. Created once per provider and updated in place.
 * Individual fields are atomic; no consistency is promised across fields.
 */
public class ProviderHealthRecord {

    private final ProviderId provider;
    private final boolean configured;

    private final AtomicBoolean healthy;
    private final AtomicReference<Instant> lastCheck = new AtomicReference<>();
    private final AtomicLong responseTimeMs = new AtomicLong();
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicReference<String> lastError = new AtomicReference<>();

    ProviderHealthRecord(ProviderId provider, boolean configured) {
        this.provider = provider;
        this.configured = configured;
        this.healthy = new AtomicBoolean(configured);
        if (!configured) {
            lastError.set("provider is not configured");
        }
    }

    public ProviderId getProvider() {
        return provider;
    }

    public int getTier() {
        return provider.getTier();
    }

    public boolean isConfigured() {
        return configured;
    }

    public boolean isHealthy() {
        return configured && healthy.get();
    }

    public Instant getLastCheck() {
        return lastCheck.get();
    }

    public long getResponseTimeMs() {
        return responseTimeMs.get();
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public String getLastError() {
        return lastError.get();
    }

    void markHealthy(Instant at, long responseTime) {
        if (!configured) {
            return;
        }
        consecutiveFailures.set(0);
        lastError.set(null);
        responseTimeMs.set(responseTime);
        lastCheck.set(at);
        healthy.set(true);
    }

    /**
     * @return true if this failure flipped the record from healthy to unhealthy
     */
    boolean recordFailure(Instant at, String error, int threshold) {
        lastError.set(error);
        lastCheck.set(at);
        int failures = consecutiveFailures.incrementAndGet();
        if (failures >= threshold) {
            return healthy.getAndSet(false);
        }
        return false;
    }

    void forceUnhealthy(Instant at, String error) {
        lastError.set(error);
        lastCheck.set(at);
        healthy.set(false);
    }

    public ProviderHealthSnapshot snapshot() {
        return ProviderHealthSnapshot.builder()
                .provider(provider)
                .tier(getTier())
                .configured(configured)
                .healthy(isHealthy())
                .lastCheck(getLastCheck())
                .responseTimeMs(getResponseTimeMs())
                .consecutiveFailures(getConsecutiveFailures())
                .lastError(getLastError())
                .build();
    }
}

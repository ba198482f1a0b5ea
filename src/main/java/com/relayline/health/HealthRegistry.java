package com.relayline.health;

import com.relayline.provider.HealthCheckResult;
import com.relayline.provider.ProviderId;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Shared provider health table. Holds one record for every {@link ProviderId}; records are created
 * here and never removed.
 *
 * <p>Providers without valid configuration start unhealthy and stay that way. Configured providers
 * start healthy and turn unhealthy after {@code failureThreshold} consecutive failures; any success
 * resets the count.
 */
@Slf4j
public class HealthRegistry {

    private final Map<ProviderId, ProviderHealthRecord> records;
    private final int failureThreshold;
    private final Clock clock;

    public HealthRegistry(Set<ProviderId> configured, int failureThreshold, Clock clock) {
        this.failureThreshold = Math.max(1, failureThreshold);
        this.clock = clock;

        Map<ProviderId, ProviderHealthRecord> map = new EnumMap<>(ProviderId.class);
        for (ProviderId id : ProviderId.values()) {
            map.put(id, new ProviderHealthRecord(id, configured.contains(id)));
        }
        this.records = Collections.unmodifiableMap(map);

        log.info("Initialized HealthRegistry: configured={}, failureThreshold={}", configured, this.failureThreshold);
    }

    public ProviderHealthRecord get(ProviderId id) {
        return records.get(id);
    }

    public boolean isHealthy(ProviderId id) {
        return records.get(id).isHealthy();
    }

    public boolean isConfigured(ProviderId id) {
        return records.get(id).isConfigured();
    }

    public Set<ProviderId> healthyIds() {
        Set<ProviderId> ids = EnumSet.noneOf(ProviderId.class);
        records.forEach((id, record) -> {
            if (record.isHealthy()) {
                ids.add(id);
            }
        });
        return ids;
    }

    /**
     * Apply the outcome of a health probe.
     */
    public void recordProbe(ProviderId id, HealthCheckResult result) {
        if (result.isHealthy()) {
            recordSuccess(id, result.getResponseTimeMs());
        } else {
            recordFailure(id, result.getError());
        }
    }

    public void recordSuccess(ProviderId id, long responseTimeMs) {
        ProviderHealthRecord record = records.get(id);
        boolean wasHealthy = record.isHealthy();
        record.markHealthy(clock.instant(), responseTimeMs);
        if (!wasHealthy && record.isHealthy()) {
            log.info("Provider {} recovered ({}ms)", id, responseTimeMs);
        }
    }

    /**
     * Count a failed probe or call against the provider.
     *
     * @return true if the provider just became unhealthy
     */
    public boolean recordFailure(ProviderId id, String error) {
        boolean flipped = records.get(id).recordFailure(clock.instant(), error, failureThreshold);
        if (flipped) {
            log.warn("Provider {} marked unhealthy: {}", id, error);
        }
        return flipped;
    }

    /**
     * Mark unhealthy regardless of the failure threshold.
     */
    public void markUnhealthy(ProviderId id, String reason) {
        records.get(id).forceUnhealthy(clock.instant(), reason);
        log.warn("Provider {} forced unhealthy: {}", id, reason);
    }

    public List<ProviderHealthSnapshot> snapshot() {
        List<ProviderHealthSnapshot> snapshots = new ArrayList<>(records.size());
        for (ProviderHealthRecord record : records.values()) {
            snapshots.add(record.snapshot());
        }
        return snapshots;
    }
}

package com.relayline.health;

import com.relayline.config.RelaylineProperties;
import com.relayline.provider.ChatProvider;
import com.relayline.provider.HealthCheckResult;
import com.relayline.provider.ProviderId;
import com.relayline.provider.ProviderRegistry;
import com.relayline.routing.FallbackChainSelector;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Periodic provider health sweep, triggered opportunistically by requests.
 *
 * <p>At most one sweep runs at a time. {@link #refreshIfStale()} starts one only when the last sweep
 * is older than the configured interval, and the in-flight flag is claimed with compare-and-set so
 * concurrent callers cannot start duplicates.
 */
@Slf4j
public class HealthMonitor {

    private final ProviderRegistry providerRegistry;
    private final HealthRegistry healthRegistry;
    private final FallbackChainSelector selector;
    private final RelaylineProperties.HealthConfig config;
    private final Clock clock;
    private final Scheduler scheduler;

    private final AtomicBoolean sweepInFlight = new AtomicBoolean(false);
    private final AtomicReference<Instant> lastSweep = new AtomicReference<>(Instant.EPOCH);
    private final AtomicLong sweepCount = new AtomicLong();

    public HealthMonitor(
            ProviderRegistry providerRegistry,
            HealthRegistry healthRegistry,
            FallbackChainSelector selector,
            RelaylineProperties.HealthConfig config,
            Clock clock,
            Scheduler scheduler) {
        this.providerRegistry = providerRegistry;
        this.healthRegistry = healthRegistry;
        this.selector = selector;
        this.config = config;
        this.clock = clock;
        this.scheduler = scheduler;
    }

    /**
     * Start a background sweep if the health table is stale and no sweep is running.
     * Returns immediately; the sweep runs on the monitor's scheduler.
     *
     * @return true if this call started a sweep
     */
    public boolean refreshIfStale() {
        if (!isStale()) {
            return false;
        }
        if (!sweepInFlight.compareAndSet(false, true)) {
            return false;
        }
        // Another caller may have finished a sweep between the staleness check and the claim
        if (!isStale()) {
            sweepInFlight.set(false);
            return false;
        }

        log.debug("Health data stale, starting sweep");
        runGuardedSweep().subscribeOn(scheduler).subscribe(
                results -> { },
                error -> log.error("Health sweep failed", error));
        return true;
    }

    /**
     * Run a sweep now, ignoring the interval.
     *
     * @return probe results, or empty if a sweep was already running
     */
    public Mono<Map<ProviderId, HealthCheckResult>> forceSweep() {
        if (!sweepInFlight.compareAndSet(false, true)) {
            log.info("Health sweep already in flight, skipping forced sweep");
            return Mono.empty();
        }
        return runGuardedSweep();
    }

    /**
     * Probe every configured provider, update the health table and rebuild the fallback chains.
     * A failing probe only affects its own provider.
     */
    public Mono<Map<ProviderId, HealthCheckResult>> performCheck() {
        Duration probeTimeout = config.getProbeTimeout();
        // Adapters time out their own probes; this bound covers adapters that do not
        Duration hardLimit = probeTimeout.plus(probeTimeout);

        List<ChatProvider> targets = providerRegistry.all().stream()
                .filter(provider -> healthRegistry.isConfigured(provider.getId()))
                .toList();

        return Flux.fromIterable(targets)
                .flatMap(provider -> probe(provider, hardLimit)
                        .map(result -> Map.entry(provider.getId(), result)))
                .collectList()
                .map(entries -> {
                    Map<ProviderId, HealthCheckResult> results = new EnumMap<>(ProviderId.class);
                    for (Map.Entry<ProviderId, HealthCheckResult> entry : entries) {
                        healthRegistry.recordProbe(entry.getKey(), entry.getValue());
                        results.put(entry.getKey(), entry.getValue());
                    }
                    selector.rebuildChains();
                    long healthy = results.values().stream().filter(HealthCheckResult::isHealthy).count();
                    log.info("Health sweep complete: {}/{} providers healthy", healthy, results.size());
                    return results;
                });
    }

    public boolean isStale() {
        return Duration.between(lastSweep.get(), clock.instant()).compareTo(config.getInterval()) > 0;
    }

    public boolean isSweepInFlight() {
        return sweepInFlight.get();
    }

    public Instant getLastSweep() {
        return lastSweep.get();
    }

    public long getSweepCount() {
        return sweepCount.get();
    }

    private Mono<Map<ProviderId, HealthCheckResult>> runGuardedSweep() {
        return Mono.defer(() -> {
                    sweepCount.incrementAndGet();
                    return performCheck();
                })
                .doFinally(signal -> {
                    lastSweep.set(clock.instant());
                    sweepInFlight.set(false);
                });
    }

    private Mono<HealthCheckResult> probe(ChatProvider provider, Duration hardLimit) {
        return Mono.defer(provider::healthCheck)
                .timeout(hardLimit)
                .onErrorResume(error -> {
                    log.warn("Health probe for {} failed: {}", provider.getId(), error.toString());
                    return Mono.just(HealthCheckResult.unhealthy(hardLimit.toMillis(), error.toString()));
                })
                .defaultIfEmpty(HealthCheckResult.unhealthy(0, "probe returned no result"));
    }
}

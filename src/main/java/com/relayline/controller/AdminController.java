package com.relayline.controller;

import com.relayline.health.HealthMonitor;
import com.relayline.health.HealthRegistry;
import com.relayline.model.QueryType;
import com.relayline.provider.HealthCheckResult;
import com.relayline.provider.ProviderId;
import com.relayline.ratelimit.RateLimitStatus;
import com.relayline.ratelimit.RateLimiter;
import com.relayline.routing.FallbackChain;
import com.relayline.routing.FallbackChainSelector;
import com.relayline.service.OperatorAlertListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operational view of the orchestration engine: provider health, fallback chains and rate limits.
 */
@Slf4j
@RestController
@RequestMapping("/v1/admin")
public class AdminController {

    private final HealthRegistry healthRegistry;
    private final HealthMonitor healthMonitor;
    private final FallbackChainSelector chainSelector;
    private final RateLimiter rateLimiter;
    private final OperatorAlertListener alertListener;

    public AdminController(
            HealthRegistry healthRegistry,
            HealthMonitor healthMonitor,
            FallbackChainSelector chainSelector,
            RateLimiter rateLimiter,
            OperatorAlertListener alertListener) {
        this.healthRegistry = healthRegistry;
        this.healthMonitor = healthMonitor;
        this.chainSelector = chainSelector;
        this.rateLimiter = rateLimiter;
        this.alertListener = alertListener;
    }

    /**
     * Health table with sweep bookkeeping.
     */
    @GetMapping("/providers")
    public ResponseEntity<Map<String, Object>> getProviders() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("providers", healthRegistry.snapshot());
        body.put("last_sweep", healthMonitor.getLastSweep());
        body.put("sweep_in_flight", healthMonitor.isSweepInFlight());
        body.put("auth_failures", alertListener.authFailureCounts());
        return ResponseEntity.ok(body);
    }

    /**
     * Run a health sweep now. Answers 409 if one is already running.
     */
    @PostMapping("/providers/health-check")
    public Mono<ResponseEntity<Map<String, Object>>> runHealthCheck() {
        log.info("Admin: forced health sweep requested");
        return healthMonitor.forceSweep()
                .map(results -> {
                    Map<String, HealthCheckResult> byName = new LinkedHashMap<>();
                    for (Map.Entry<ProviderId, HealthCheckResult> entry : results.entrySet()) {
                        byName.put(entry.getKey().getWireName(), entry.getValue());
                    }
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("status", "completed");
                    body.put("results", byName);
                    return ResponseEntity.ok(body);
                })
                .defaultIfEmpty(ResponseEntity.status(HttpStatus.CONFLICT).body(inProgress()));
    }

    @GetMapping("/fallback-chains")
    public ResponseEntity<Map<String, FallbackChain>> getFallbackChains() {
        Map<String, FallbackChain> chains = new LinkedHashMap<>();
        for (Map.Entry<QueryType, FallbackChain> entry : chainSelector.getChains().entrySet()) {
            chains.put(entry.getKey().getWireName(), entry.getValue());
        }
        return ResponseEntity.ok(chains);
    }

    @GetMapping("/rate-limits")
    public ResponseEntity<List<RateLimitStatus>> getRateLimits() {
        return ResponseEntity.ok(rateLimiter.snapshot());
    }

    private static Map<String, Object> inProgress() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "in_progress");
        return body;
    }
}

package com.relayline.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Raises operator-visible alerts for failures that fallback cannot recover from.
 */
@Slf4j
@Component
public class OperatorAlertListener {

    private final Map<String, AtomicLong> authFailures = new ConcurrentHashMap<>();

    @EventListener
    public void onProviderAuthFailure(ProviderAuthFailureEvent event) {
        long count = authFailures
                .computeIfAbsent(event.provider().getWireName(), key -> new AtomicLong())
                .incrementAndGet();
        log.error("OPERATOR ALERT [{}]: provider {} rejected credentials (status {}, occurrence {}): {}",
                event.requestId(), event.provider(), event.status(), count, event.message());
    }

    public Map<String, Long> authFailureCounts() {
        Map<String, Long> counts = new ConcurrentHashMap<>();
        authFailures.forEach((provider, count) -> counts.put(provider, count.get()));
        return counts;
    }
}

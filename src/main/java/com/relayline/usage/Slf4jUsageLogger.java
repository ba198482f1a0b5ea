package com.relayline.usage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Writes usage events to the {@code relayline.usage} logger as key=value lines.
 */
@Component
public class Slf4jUsageLogger implements UsageLogger {

    private static final Logger USAGE = LoggerFactory.getLogger("relayline.usage");

    @Override
    public Mono<Void> logSuccess(UsageEvent event) {
        return Mono.fromRunnable(() -> USAGE.info(
                "[{}] usage success user={} feature={} provider={} model={} tokens_in={} tokens_out={} "
                        + "latency_ms={} cached={} query_type={} tier={} fallback={}",
                event.getRequestId(), event.getUserId(), event.getFeatureName(), event.getProvider(),
                event.getModelUsed(), event.getTokensInput(), event.getTokensOutput(), event.getLatencyMs(),
                event.isCached(), event.getQueryType(), event.getTierUsed(), event.isFallbackUsed()));
    }

    @Override
    public Mono<Void> logFailure(UsageEvent event) {
        return Mono.fromRunnable(() -> USAGE.warn(
                "[{}] usage failure user={} feature={} provider={} model={} latency_ms={} query_type={} "
                        + "tier={} fallback={} error={}",
                event.getRequestId(), event.getUserId(), event.getFeatureName(), event.getProvider(),
                event.getModelUsed(), event.getLatencyMs(), event.getQueryType(), event.getTierUsed(),
                event.isFallbackUsed(), event.getErrorMessage()));
    }
}

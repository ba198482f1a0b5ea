package com.relayline.usage;

import reactor.core.publisher.Mono;

/**
 * Sink for usage telemetry. Callers subscribe fire-and-forget; a failing logger never fails a request.
 */
public interface UsageLogger {

    Mono<Void> logSuccess(UsageEvent event);

    Mono<Void> logFailure(UsageEvent event);
}

package com.relayline.context;

import reactor.core.publisher.Mono;

/**
 * Source of per-user study context.
 */
public interface AppDataContextProvider {

    /**
     * @param userId user to load context for
     * @return context, or empty when none is available
     */
    Mono<AppDataContext> load(String userId);
}

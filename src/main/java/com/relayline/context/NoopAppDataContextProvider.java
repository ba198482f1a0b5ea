package com.relayline.context;

import reactor.core.publisher.Mono;

/**
 * Used when no app-data service is configured.
 */
public class NoopAppDataContextProvider implements AppDataContextProvider {

    @Override
    public Mono<AppDataContext> load(String userId) {
        return Mono.empty();
    }
}

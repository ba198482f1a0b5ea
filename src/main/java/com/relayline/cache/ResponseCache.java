package com.relayline.cache;

import com.relayline.model.ProviderResponse;

import java.util.Optional;

/**
 * Fingerprint-keyed, TTL-bounded store of successful provider responses.
 * Implementations must be safe for concurrent use and must not throw: a cache failure
 * behaves like a miss.
 */
public interface ResponseCache {

    /**
     * Look up a live entry.
     *
     * @param fingerprint request fingerprint from {@link RequestFingerprinter}
     * @return stored response, marked {@code cached=true}
     */
    Optional<ProviderResponse> get(String fingerprint);

    void put(String fingerprint, ProviderResponse response);

    void clear();

    CacheStats stats();
}

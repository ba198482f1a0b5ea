package com.relayline.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.relayline.config.RelaylineProperties;
import com.relayline.model.ProviderResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.cache.CacheManager;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process response cache backed by the Caffeine {@code responses} cache.
 * Caffeine bounds size and evicts after write; entries also carry their own creation time so that
 * expiry follows the injected clock.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "relayline.cache", name = "backend", havingValue = "local", matchIfMissing = true)
public class LocalResponseCache implements ResponseCache {

    public static final String CACHE_NAME = "responses";

    private final org.springframework.cache.Cache cache;
    private final RelaylineProperties.CacheConfig config;
    private final Clock clock;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public LocalResponseCache(CacheManager cacheManager, RelaylineProperties properties, Clock clock) {
        this.cache = cacheManager.getCache(CACHE_NAME);
        if (this.cache == null) {
            throw new IllegalStateException("Cache '" + CACHE_NAME + "' is not configured");
        }
        this.config = properties.getCache();
        this.clock = clock;
    }

    @Override
    public Optional<ProviderResponse> get(String fingerprint) {
        if (!config.isEnabled() || fingerprint == null) {
            return Optional.empty();
        }

        CachedResponse entry = cache.get(fingerprint, CachedResponse.class);
        if (entry == null) {
            misses.incrementAndGet();
            log.debug("Cache MISS: {}", fingerprint);
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            cache.evict(fingerprint);
            misses.incrementAndGet();
            log.debug("Cache EXPIRED: {}", fingerprint);
            return Optional.empty();
        }

        hits.incrementAndGet();
        log.debug("Cache HIT: {}", fingerprint);
        return Optional.of(entry.getResponse().toBuilder().cached(true).build());
    }

    @Override
    public void put(String fingerprint, ProviderResponse response) {
        if (!config.isEnabled() || fingerprint == null || response == null) {
            return;
        }
        cache.put(fingerprint, CachedResponse.builder()
                .fingerprint(fingerprint)
                .response(response.toBuilder().build())
                .createdAt(clock.instant())
                .ttl(config.getTtl())
                .build());
        log.debug("Cached response: key={}, provider={}", fingerprint, response.getProvider());
    }

    @Override
    public void clear() {
        cache.clear();
        log.info("Local response cache cleared");
    }

    @Override
    public CacheStats stats() {
        long entries = 0;
        if (cache instanceof CaffeineCache caffeineCache) {
            Cache<Object, Object> nativeCache = caffeineCache.getNativeCache();
            nativeCache.cleanUp();
            entries = nativeCache.estimatedSize();
        }
        return CacheStats.builder()
                .backend("local")
                .enabled(config.isEnabled())
                .entries(entries)
                .hits(hits.get())
                .misses(misses.get())
                .build();
    }
}

package com.relayline.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.relayline.config.RelaylineProperties;
import com.relayline.model.ProviderResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Clock;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Redis-backed response cache with GZIP-compressed JSON values.
 * Key pattern: relayline:response:{fingerprint}
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "relayline.cache", name = "backend", havingValue = "redis")
public class RedisResponseCache implements ResponseCache {

    private static final String KEY_PREFIX = "relayline:response:";

    private final RedisTemplate<String, byte[]> redisTemplate;
    private final ObjectMapper objectMapper;
    private final RelaylineProperties.CacheConfig config;
    private final Clock clock;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public RedisResponseCache(
            RedisTemplate<String, byte[]> redisTemplate,
            ObjectMapper objectMapper,
            RelaylineProperties properties,
            Clock clock) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.config = properties.getCache();
        this.clock = clock;
    }

    @Override
    public Optional<ProviderResponse> get(String fingerprint) {
        if (!config.isEnabled() || fingerprint == null) {
            return Optional.empty();
        }
        try {
            byte[] compressed = redisTemplate.opsForValue().get(KEY_PREFIX + fingerprint);
            if (compressed == null) {
                misses.incrementAndGet();
                log.debug("Redis cache miss: {}", fingerprint);
                return Optional.empty();
            }

            CachedResponse entry = decompress(compressed);
            if (entry.isExpired(clock.instant())) {
                misses.incrementAndGet();
                return Optional.empty();
            }

            hits.incrementAndGet();
            log.debug("Redis cache hit: {}", fingerprint);
            return Optional.of(entry.getResponse().toBuilder().cached(true).build());
        } catch (Exception e) {
            log.error("Error retrieving from Redis cache: key={}", fingerprint, e);
            misses.incrementAndGet();
            return Optional.empty();
        }
    }

    @Override
    public void put(String fingerprint, ProviderResponse response) {
        if (!config.isEnabled() || fingerprint == null || response == null) {
            return;
        }
        try {
            CachedResponse entry = CachedResponse.builder()
                    .fingerprint(fingerprint)
                    .response(response)
                    .createdAt(clock.instant())
                    .ttl(config.getTtl())
                    .build();
            byte[] compressed = compress(entry);
            redisTemplate.opsForValue().set(KEY_PREFIX + fingerprint, compressed, config.getTtl());
            log.debug("Stored in Redis cache: key={}, ttl={}, size={}B", fingerprint, config.getTtl(), compressed.length);
        } catch (Exception e) {
            // A failed write only costs a future miss
            log.error("Error storing to Redis cache: key={}", fingerprint, e);
        }
    }

    @Override
    public void clear() {
        try {
            Set<String> keys = redisTemplate.keys(KEY_PREFIX + "*");
            if (keys != null && !keys.isEmpty()) {
                redisTemplate.delete(keys);
                log.info("Cleared {} entries from Redis cache", keys.size());
            }
        } catch (Exception e) {
            log.error("Error clearing Redis cache", e);
        }
    }

    @Override
    public CacheStats stats() {
        long entries = 0;
        try {
            Set<String> keys = redisTemplate.keys(KEY_PREFIX + "*");
            entries = keys != null ? keys.size() : 0;
        } catch (Exception e) {
            log.warn("Could not count Redis cache entries: {}", e.getMessage());
        }
        return CacheStats.builder()
                .backend("redis")
                .enabled(config.isEnabled())
                .entries(entries)
                .hits(hits.get())
                .misses(misses.get())
                .build();
    }

    private byte[] compress(CachedResponse entry) throws IOException {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            try (GZIPOutputStream gzipOut = new GZIPOutputStream(baos)) {
                gzipOut.write(objectMapper.writeValueAsBytes(entry));
            }
            return baos.toByteArray();
        }
    }

    private CachedResponse decompress(byte[] compressed) throws IOException {
        try (GZIPInputStream gzipIn = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return objectMapper.readValue(gzipIn.readAllBytes(), CachedResponse.class);
        }
    }
}

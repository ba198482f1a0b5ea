package com.relayline.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.relayline.cache.LocalResponseCache;
import org.springframework.cache.CacheManager;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Cache configuration for Caffeine.
 */
@Configuration
public class CacheConfiguration {

    private final RelaylineProperties properties;

    public CacheConfiguration(RelaylineProperties properties) {
        this.properties = properties;
    }

    @Bean
    public CacheManager cacheManager() {
        return createCacheManager(properties.getCache());
    }

    public static CacheManager createCacheManager(RelaylineProperties.CacheConfig config) {
        CaffeineCacheManager cacheManager = new CaffeineCacheManager(LocalResponseCache.CACHE_NAME);
        cacheManager.setCaffeine(Caffeine.newBuilder()
                .maximumSize(config.getMaxSize())
                .expireAfterWrite(config.getTtl())
                .recordStats());
        return cacheManager;
    }
}

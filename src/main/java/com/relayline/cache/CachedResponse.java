package com.relayline.cache;

import com.relayline.model.ProviderResponse;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Cache entry: the stored response plus its creation time and TTL.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CachedResponse {

    private String fingerprint;

    private ProviderResponse response;

    private Instant createdAt;

    private Duration ttl;

    public boolean isExpired(Instant now) {
        return createdAt == null || ttl == null || !now.isBefore(createdAt.plus(ttl));
    }
}

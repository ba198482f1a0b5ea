package com.relayline.cache;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CacheStats {

    @JsonProperty("backend")
    String backend;

    @JsonProperty("enabled")
    boolean enabled;

    @JsonProperty("entries")
    long entries;

    @JsonProperty("hits")
    long hits;

    @JsonProperty("misses")
    long misses;

    @JsonProperty("hit_rate")
    public double getHitRate() {
        long lookups = hits + misses;
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }
}

package com.relayline.health;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.relayline.provider.ProviderId;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time copy of a {@link ProviderHealthRecord}, safe to serialize.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProviderHealthSnapshot {

    @JsonProperty("provider")
    ProviderId provider;

    @JsonProperty("tier")
    int tier;

    @JsonProperty("configured")
    boolean configured;

    @JsonProperty("healthy")
    boolean healthy;

    @JsonProperty("last_check")
    Instant lastCheck;

    @JsonProperty("response_time_ms")
    long responseTimeMs;

    @JsonProperty("consecutive_failures")
    int consecutiveFailures;

    @JsonProperty("last_error")
    String lastError;
}

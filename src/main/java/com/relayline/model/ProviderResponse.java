package com.relayline.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Chat-shaped response returned to the caller. Exactly one is produced per request,
 * whether it came from a provider, the cache, graceful degradation or the critical-error path.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProviderResponse {

    /**
     * Provider value reported for responses the engine produced itself.
     */
    public static final String SYSTEM_PROVIDER = "system";

    /**
     * Tier reported for system responses, one past the least preferred provider.
     */
    public static final int SYSTEM_TIER = 7;

    @JsonProperty("content")
    private String content;

    @JsonProperty("model_used")
    private String modelUsed;

    @JsonProperty("provider")
    private String provider;

    @JsonProperty("query_type")
    private QueryType queryType;

    @JsonProperty("tier_used")
    private int tierUsed;

    @JsonProperty("cached")
    private boolean cached;

    @JsonProperty("tokens_used")
    @Builder.Default
    private TokenUsage tokensUsed = TokenUsage.zero();

    @JsonProperty("latency_ms")
    private long latencyMs;

    @JsonProperty("web_search_enabled")
    private boolean webSearchEnabled;

    @JsonProperty("fallback_used")
    private boolean fallbackUsed;

    @JsonProperty("limit_approaching")
    private boolean limitApproaching;
}

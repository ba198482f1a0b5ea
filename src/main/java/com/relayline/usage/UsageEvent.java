package com.relayline.usage;

import com.relayline.model.QueryType;
import lombok.Builder;
import lombok.Value;

/**
 * One usage record: a provider success, a provider failure or a system fallback.
 */
@Value
@Builder
public class UsageEvent {

    public static final String FEATURE_AI_CHAT = "ai_chat";

    String requestId;

    String userId;

    @Builder.Default
    String featureName = FEATURE_AI_CHAT;

    String provider;

    String modelUsed;

    int tokensInput;

    int tokensOutput;

    long latencyMs;

    boolean cached;

    QueryType queryType;

    int tierUsed;

    boolean fallbackUsed;

    /**
     * Null for successes.
     */
    String errorMessage;
}

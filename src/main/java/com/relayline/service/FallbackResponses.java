package com.relayline.service;

import com.relayline.model.ProviderResponse;
import com.relayline.model.QueryType;
import com.relayline.model.TokenUsage;

/**
 * Canned responses the engine returns itself when no provider could answer.
 */
public final class FallbackResponses {

    public static final String DEGRADATION_MODEL = "graceful_degradation";
    public static final String CRITICAL_MODEL = "error_handler";

    public static final String CRITICAL_MESSAGE =
            "I apologize, but I'm experiencing technical difficulties. Please try again in a moment.";

    private FallbackResponses() {
    }

    public static String degradationMessage(QueryType queryType) {
        if (queryType == null) {
            queryType = QueryType.GENERAL;
        }
        switch (queryType) {
            case TIME_SENSITIVE:
                return "I apologize, but I'm unable to access current information right now. "
                        + "Please try again later or check official sources for the latest updates.";
            case APP_DATA:
                return "I'm having trouble accessing your study data right now. "
                        + "Please try again in a moment, or check your dashboard for the latest progress updates.";
            case GENERAL:
            default:
                return "I'm experiencing high demand right now. Please try again in a few moments, "
                        + "and I'll be happy to help!";
        }
    }

    /**
     * Response for an exhausted fallback chain.
     */
    public static ProviderResponse degradation(QueryType queryType, boolean fallbackUsed, long latencyMs) {
        QueryType type = queryType != null ? queryType : QueryType.GENERAL;
        return systemResponse(degradationMessage(type), DEGRADATION_MODEL, type, fallbackUsed, latencyMs);
    }

    /**
     * Response for an unexpected failure inside the orchestrator.
     */
    public static ProviderResponse critical(long latencyMs) {
        return systemResponse(CRITICAL_MESSAGE, CRITICAL_MODEL, QueryType.GENERAL, false, latencyMs);
    }

    private static ProviderResponse systemResponse(
            String content, String model, QueryType queryType, boolean fallbackUsed, long latencyMs) {
        return ProviderResponse.builder()
                .content(content)
                .modelUsed(model)
                .provider(ProviderResponse.SYSTEM_PROVIDER)
                .queryType(queryType)
                .tierUsed(ProviderResponse.SYSTEM_TIER)
                .cached(false)
                .tokensUsed(TokenUsage.zero())
                .latencyMs(latencyMs)
                .webSearchEnabled(false)
                .fallbackUsed(fallbackUsed)
                .limitApproaching(false)
                .build();
    }
}

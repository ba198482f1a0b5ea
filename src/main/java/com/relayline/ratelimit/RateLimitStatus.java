package com.relayline.ratelimit;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.relayline.provider.ProviderId;
import lombok.Builder;
import lombok.Value;

/**
 * Current window usage of one provider.
 */
@Value
@Builder
public class RateLimitStatus {

    public enum Status {
        @JsonProperty("ok")
        OK,
        @JsonProperty("blocked")
        BLOCKED
    }

    @JsonProperty("provider")
    ProviderId provider;

    @JsonProperty("status")
    Status status;

    @JsonProperty("requests")
    int requests;

    @JsonProperty("requests_limit")
    int requestsLimit;

    @JsonProperty("tokens")
    long tokens;

    @JsonProperty("tokens_limit")
    long tokensLimit;

    /**
     * Usage has crossed the warning ratio of either limit.
     */
    @JsonProperty("approaching")
    boolean approaching;

    public boolean isBlocked() {
        return status == Status.BLOCKED;
    }
}

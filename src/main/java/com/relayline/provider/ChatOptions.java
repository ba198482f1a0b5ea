package com.relayline.provider;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Per-call overrides; unset values fall back to the provider's configuration.
 */
@Value
@Builder
public class ChatOptions {

    Double temperature;

    Integer maxTokens;

    Duration timeout;

    public static ChatOptions defaults() {
        return ChatOptions.builder().build();
    }
}

package com.relayline.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Token counts normalized across providers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenUsage {

    @JsonProperty("input")
    private int input;

    @JsonProperty("output")
    private int output;

    public static TokenUsage zero() {
        return new TokenUsage(0, 0);
    }

    public int total() {
        return input + output;
    }
}

package com.relayline.provider;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

/**
 * Outcome of one health probe.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HealthCheckResult {

    boolean healthy;

    long responseTimeMs;

    String error;

    public static HealthCheckResult healthy(long responseTimeMs) {
        return new HealthCheckResult(true, responseTimeMs, null);
    }

    public static HealthCheckResult unhealthy(long responseTimeMs, String error) {
        return new HealthCheckResult(false, responseTimeMs, error);
    }
}

package com.relayline.service;

import com.relayline.provider.ProviderId;

import java.time.Instant;

/**
 * Published when a provider rejects its credentials. Fallback cannot fix this, so an operator must.
 */
public record ProviderAuthFailureEvent(
        String requestId,
        ProviderId provider,
        int status,
        String message,
        Instant occurredAt) {
}

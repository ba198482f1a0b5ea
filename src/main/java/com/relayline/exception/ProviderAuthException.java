package com.relayline.exception;

import com.relayline.provider.ProviderId;

/**
 * 401/403 from upstream. Never retried; falling back cannot fix a bad credential,
 * so the orchestrator also raises an operator alert.
 */
public class ProviderAuthException extends ProviderException {

    public ProviderAuthException(ProviderId provider, int status, String message, Throwable cause) {
        super(provider, status, message, cause);
    }
}

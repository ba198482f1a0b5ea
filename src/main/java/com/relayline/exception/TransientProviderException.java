package com.relayline.exception;

import com.relayline.provider.ProviderId;

/**
 * Timeout, 5xx, 429 or connection failure. Retried inside the adapter.
 */
public class TransientProviderException extends ProviderException {

    public TransientProviderException(ProviderId provider, int status, String message, Throwable cause) {
        super(provider, status, message, cause);
    }

    public TransientProviderException(ProviderId provider, String message, Throwable cause) {
        super(provider, 0, message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}

package com.relayline.exception;

import com.relayline.provider.ProviderId;
import lombok.Getter;

/**
 * Failure reported by a provider adapter.
 * Instances of this class itself are permanent failures (unexpected 4xx, malformed body)
 * and are never retried; subclasses refine the category.
 */
@Getter
public class ProviderException extends RelaylineException {

    private final ProviderId provider;

    /**
     * Upstream HTTP status, or 0 when the failure happened before a response arrived.
     */
    private final int status;

    public ProviderException(ProviderId provider, String message) {
        this(provider, 0, message, null);
    }

    public ProviderException(ProviderId provider, String message, Throwable cause) {
        this(provider, 0, message, cause);
    }

    public ProviderException(ProviderId provider, int status, String message, Throwable cause) {
        super(provider.getWireName() + ": " + message, cause);
        this.provider = provider;
        this.status = status;
    }

    /**
     * Whether the adapter may retry the call that produced this failure.
     */
    public boolean isTransient() {
        return false;
    }
}

package com.relayline.exception;

import com.relayline.provider.ProviderId;
import lombok.Getter;

import java.time.Duration;

/**
 * The adapter aborted a call that exceeded its call timeout.
 */
@Getter
public class ProviderTimeoutException extends TransientProviderException {

    private final Duration timeout;

    public ProviderTimeoutException(ProviderId provider, Duration timeout, Throwable cause) {
        super(provider, "request timeout after " + timeout.toMillis() + "ms", cause);
        this.timeout = timeout;
    }
}

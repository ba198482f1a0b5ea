package com.relayline.exception;

import com.relayline.provider.ProviderId;

/**
 * Provider cannot be used with the current configuration (disabled or missing API key).
 */
public class ProviderConfigException extends ProviderException {

    public ProviderConfigException(ProviderId provider, String message) {
        super(provider, message);
    }
}

package com.relayline.provider;

import com.relayline.model.Message;
import com.relayline.model.ProviderResponse;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Interface for chat providers.
 * Implementations handle provider-specific authentication, wire format, retry and timeout,
 * and normalize the result into a {@link ProviderResponse}. They never touch shared health state.
 */
public interface ChatProvider {

    /**
     * Get the provider identity.
     *
     * @return provider id
     */
    ProviderId getId();

    /**
     * Static tier of this provider.
     *
     * @return tier, lower is preferred
     */
    default int getTier() {
        return getId().getTier();
    }

    /**
     * Check if provider is enabled and has credentials.
     *
     * @return true if ready to use
     */
    boolean isEnabled();

    /**
     * Complete a chat request.
     *
     * @param messages conversation in provider-neutral form
     * @param model    provider model id, or null for the provider default
     * @param options  per-call overrides
     * @return normalized response; errors are {@link com.relayline.exception.ProviderException}s
     */
    Mono<ProviderResponse> chat(List<Message> messages, String model, ChatOptions options);

    /**
     * Issue a minimal probe to measure reachability and latency. Never signals an error.
     *
     * @return probe outcome
     */
    Mono<HealthCheckResult> healthCheck();
}

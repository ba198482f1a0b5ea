package com.relayline.provider;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of provider adapters keyed by {@link ProviderId}.
 * Dispatch is polymorphic; a provider id with no registered adapter is simply absent.
 */
@Slf4j
@Component
public class ProviderRegistry {

    private final Map<ProviderId, ChatProvider> providers = new EnumMap<>(ProviderId.class);

    public ProviderRegistry(List<ChatProvider> providers) {
        for (ChatProvider provider : providers) {
            ChatProvider previous = this.providers.putIfAbsent(provider.getId(), provider);
            if (previous != null) {
                throw new IllegalStateException("Duplicate adapter registered for provider " + provider.getId());
            }
        }
        log.info("Initialized ProviderRegistry with {} providers: {} (enabled: {})",
                this.providers.size(), this.providers.keySet(), enabledIds());
    }

    public Optional<ChatProvider> get(ProviderId id) {
        return Optional.ofNullable(providers.get(id));
    }

    public Collection<ChatProvider> all() {
        return Collections.unmodifiableCollection(providers.values());
    }

    /**
     * Providers that have an adapter and valid configuration.
     */
    public Set<ProviderId> enabledIds() {
        Set<ProviderId> enabled = EnumSet.noneOf(ProviderId.class);
        providers.forEach((id, provider) -> {
            if (provider.isEnabled()) {
                enabled.add(id);
            }
        });
        return enabled;
    }
}

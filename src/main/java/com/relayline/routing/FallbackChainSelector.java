package com.relayline.routing;

import com.relayline.config.RelaylineProperties;
import com.relayline.config.RelaylineProperties.ChainRebuildMode;
import com.relayline.health.HealthRegistry;
import com.relayline.model.QueryType;
import com.relayline.provider.ProviderId;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds per-query-type fallback chains from the configured base orders and the health table.
 *
 * <p>Chains are rebuilt after each health sweep and published as an immutable map. {@link #select}
 * filters the published chain again against current health, then moves a preferred provider to the front.
 */
@Slf4j
public class FallbackChainSelector {

    private final HealthRegistry healthRegistry;
    private final ChainRebuildMode rebuildMode;
    private final Map<QueryType, List<ProviderId>> baseOrders;

    private volatile Map<QueryType, FallbackChain> chains;

    public FallbackChainSelector(HealthRegistry healthRegistry, RelaylineProperties.RoutingConfig config) {
        this.healthRegistry = healthRegistry;
        this.rebuildMode = config.getRebuildMode();
        this.baseOrders = parseBaseOrders(config.getChains());
        rebuildChains();
    }

    /**
     * Candidate chain for a query type.
     *
     * @param queryType classified intent
     * @param preferred provider name requested by the caller, may be null
     * @return deduplicated chain of healthy providers, with the preferred provider first when it names a known provider
     */
    public FallbackChain select(QueryType queryType, String preferred) {
        FallbackChain published = chains.get(queryType);

        List<ProviderId> candidates = new ArrayList<>(published.size());
        for (ProviderId id : published.getProviders()) {
            if (healthRegistry.isHealthy(id)) {
                candidates.add(id);
            }
        }

        ProviderId preferredId = null;
        if (preferred != null && !preferred.isBlank()) {
            Optional<ProviderId> resolved = ProviderId.fromName(preferred);
            if (resolved.isPresent()) {
                preferredId = resolved.get();
            } else {
                log.warn("Ignoring unknown preferred provider '{}'", preferred);
            }
        }

        return FallbackChain.of(queryType, candidates, preferredId);
    }

    /**
     * Rebuild every chain from the current health table.
     */
    public void rebuildChains() {
        Set<ProviderId> healthy = healthRegistry.healthyIds();
        Map<QueryType, FallbackChain> rebuilt = new EnumMap<>(QueryType.class);

        for (QueryType type : QueryType.values()) {
            List<ProviderId> ordered;
            if (rebuildMode == ChainRebuildMode.TIER_ORDER) {
                ordered = new ArrayList<>(healthy);
                ordered.sort(Comparator.comparingInt(ProviderId::getTier));
            } else {
                ordered = new ArrayList<>();
                for (ProviderId id : baseOrders.get(type)) {
                    if (healthy.contains(id)) {
                        ordered.add(id);
                    }
                }
            }
            rebuilt.put(type, FallbackChain.of(type, ordered));
        }

        this.chains = Collections.unmodifiableMap(rebuilt);
        log.debug("Rebuilt fallback chains ({}): {}", rebuildMode, rebuilt);
    }

    public Map<QueryType, FallbackChain> getChains() {
        return chains;
    }

    private static Map<QueryType, List<ProviderId>> parseBaseOrders(Map<String, List<String>> configured) {
        Map<QueryType, List<ProviderId>> orders = new EnumMap<>(QueryType.class);
        if (configured != null) {
            configured.forEach((typeName, names) -> {
                Optional<QueryType> type = QueryType.fromName(typeName);
                if (type.isEmpty()) {
                    log.warn("Ignoring fallback chain for unknown query type '{}'", typeName);
                    return;
                }
                Set<ProviderId> ids = new LinkedHashSet<>();
                for (String name : names) {
                    ProviderId.fromName(name).ifPresentOrElse(
                            ids::add,
                            () -> log.warn("Ignoring unknown provider '{}' in {} chain", name, typeName));
                }
                orders.put(type.get(), List.copyOf(ids));
            });
        }

        // Query types without a configured chain fall back to tier order
        List<ProviderId> tierOrder = new ArrayList<>(Arrays.asList(ProviderId.values()));
        tierOrder.sort(Comparator.comparingInt(ProviderId::getTier));
        for (QueryType type : QueryType.values()) {
            orders.putIfAbsent(type, List.copyOf(tierOrder));
        }
        return orders;
    }
}

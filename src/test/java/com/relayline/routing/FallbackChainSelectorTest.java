package com.relayline.routing;

import com.relayline.config.RelaylineProperties;
import com.relayline.health.HealthRegistry;
import com.relayline.model.QueryType;
import com.relayline.provider.ProviderId;
import com.relayline.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FallbackChainSelectorTest {

    private HealthRegistry healthRegistry;
    private RelaylineProperties.RoutingConfig routing;

    @BeforeEach
    void setUp() {
        healthRegistry = new HealthRegistry(
                EnumSet.allOf(ProviderId.class), 1, MutableClock.startingAt("2025-01-15T10:00:00Z"));
        routing = new RelaylineProperties.RoutingConfig();
    }

    @Test
    void defaultChainsFollowQueryTypeOrder() {
        FallbackChainSelector selector = new FallbackChainSelector(healthRegistry, routing);

        assertEquals(List.of(ProviderId.GEMINI, ProviderId.GROQ, ProviderId.CEREBRAS,
                        ProviderId.MISTRAL, ProviderId.OPENROUTER, ProviderId.COHERE),
                selector.select(QueryType.TIME_SENSITIVE, null).getProviders());
        assertEquals(List.of(ProviderId.GROQ, ProviderId.CEREBRAS, ProviderId.MISTRAL,
                        ProviderId.GEMINI, ProviderId.OPENROUTER, ProviderId.COHERE),
                selector.select(QueryType.APP_DATA, null).getProviders());
        assertEquals(ProviderId.GROQ, selector.select(QueryType.GENERAL, null).first());
    }

    @Test
    void chainsNeverRepeatProviders() {
        routing.setChains(Map.of("general", List.of("groq", "gemini", "GROQ", "gemini", "cohere")));
        FallbackChainSelector selector = new FallbackChainSelector(healthRegistry, routing);

        FallbackChain chain = selector.select(QueryType.GENERAL, "gemini");

        assertEquals(List.of(ProviderId.GEMINI, ProviderId.GROQ, ProviderId.COHERE), chain.getProviders());
        assertEquals(chain.size(), new HashSet<>(chain.getProviders()).size());
    }

    @Test
    void unhealthyProvidersAreFilteredAtSelectionTime() {
        FallbackChainSelector selector = new FallbackChainSelector(healthRegistry, routing);

        healthRegistry.markUnhealthy(ProviderId.GEMINI, "down");

        FallbackChain chain = selector.select(QueryType.TIME_SENSITIVE, null);
        assertEquals(ProviderId.GROQ, chain.first());
        assertFalse(chain.getProviders().contains(ProviderId.GEMINI));
    }

    @Test
    void preferredProviderGoesFirstEvenWhenUnhealthy() {
        FallbackChainSelector selector = new FallbackChainSelector(healthRegistry, routing);
        healthRegistry.markUnhealthy(ProviderId.COHERE, "down");
        healthRegistry.markUnhealthy(ProviderId.MISTRAL, "down");

        FallbackChain chain = selector.select(QueryType.GENERAL, "cohere");

        assertEquals(ProviderId.COHERE, chain.first());
        assertTrue(chain.isPreferred(ProviderId.COHERE));
        assertFalse(chain.getProviders().subList(1, chain.size()).contains(ProviderId.MISTRAL));
        assertEquals(1, chain.getProviders().stream().filter(id -> id == ProviderId.COHERE).count());
    }

    @Test
    void unknownPreferredProviderIsIgnored() {
        FallbackChainSelector selector = new FallbackChainSelector(healthRegistry, routing);

        FallbackChain chain = selector.select(QueryType.GENERAL, "not-a-provider");

        assertNull(chain.getPreferred());
        assertEquals(ProviderId.GROQ, chain.first());
    }

    @Test
    void tierOrderModeSortsHealthyProvidersByTier() {
        routing.setRebuildMode(RelaylineProperties.ChainRebuildMode.TIER_ORDER);
        healthRegistry.markUnhealthy(ProviderId.CEREBRAS, "down");
        FallbackChainSelector selector = new FallbackChainSelector(healthRegistry, routing);

        List<ProviderId> expected = List.of(ProviderId.GROQ, ProviderId.GEMINI, ProviderId.COHERE,
                ProviderId.MISTRAL, ProviderId.OPENROUTER);
        for (QueryType type : QueryType.values()) {
            assertEquals(expected, selector.getChains().get(type).getProviders(), type.getWireName());
        }
    }

    @Test
    void rebuildDropsUnhealthyProvidersFromPublishedChains() {
        FallbackChainSelector selector = new FallbackChainSelector(healthRegistry, routing);
        healthRegistry.markUnhealthy(ProviderId.GROQ, "down");

        selector.rebuildChains();

        for (FallbackChain chain : selector.getChains().values()) {
            assertFalse(chain.getProviders().contains(ProviderId.GROQ));
        }
    }

    @Test
    void chainKeysAcceptBoundPropertyNames() {
        routing.setChains(Map.of("timesensitive", List.of("cohere", "groq")));
        FallbackChainSelector selector = new FallbackChainSelector(healthRegistry, routing);

        assertEquals(List.of(ProviderId.COHERE, ProviderId.GROQ),
                selector.select(QueryType.TIME_SENSITIVE, null).getProviders());
    }
}

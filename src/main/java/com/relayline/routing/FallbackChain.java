package com.relayline.routing;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.relayline.model.QueryType;
import com.relayline.provider.ProviderId;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Ordered candidate list for one query type. Never contains a provider twice.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FallbackChain {

    @JsonProperty("query_type")
    QueryType queryType;

    @JsonProperty("providers")
    List<ProviderId> providers;

    /**
     * Caller-preferred provider placed at position 0, if any.
     */
    @JsonProperty("preferred")
    ProviderId preferred;

    public static FallbackChain of(QueryType queryType, Collection<ProviderId> providers) {
        return of(queryType, providers, null);
    }

    public static FallbackChain of(QueryType queryType, Collection<ProviderId> providers, ProviderId preferred) {
        List<ProviderId> ordered = new ArrayList<>(new LinkedHashSet<>(providers));
        if (preferred != null) {
            ordered.remove(preferred);
            ordered.add(0, preferred);
        }
        return new FallbackChain(queryType, List.copyOf(ordered), preferred);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return providers.isEmpty();
    }

    public int size() {
        return providers.size();
    }

    public ProviderId first() {
        return providers.isEmpty() ? null : providers.get(0);
    }

    public boolean isPreferred(ProviderId id) {
        return preferred != null && preferred == id;
    }
}

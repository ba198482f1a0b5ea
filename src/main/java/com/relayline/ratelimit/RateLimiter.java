package com.relayline.ratelimit;

import com.relayline.config.RelaylineProperties;
import com.relayline.provider.ProviderId;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Per-provider request and token budgets over a sliding window.
 * A limit of zero means unlimited. Each provider's window is guarded by its own lock; callers reserve a
 * slot with {@link #tryAcquire} before calling a provider and charge tokens with {@link #complete} afterwards.
 */
@Slf4j
public class RateLimiter {

    private final Map<ProviderId, Window> windows = new EnumMap<>(ProviderId.class);
    private final Duration window;
    private final double approachingRatio;
    private final Clock clock;

    public RateLimiter(RelaylineProperties properties, Clock clock) {
        this.window = properties.getRateLimit().getWindow();
        this.approachingRatio = properties.getRateLimit().getApproachingRatio();
        this.clock = clock;
        for (ProviderId id : ProviderId.values()) {
            RelaylineProperties.ProviderConfig config = properties.provider(id);
            windows.put(id, new Window(config.getRequestsPerWindow(), config.getTokensPerWindow()));
        }
    }

    public RateLimitStatus checkRateLimit(ProviderId provider) {
        return windows.get(provider).status(provider, clock.instant());
    }

    /**
     * Reserve one request slot for a call that is about to start. The check and the reservation happen
     * under the provider's window lock, so concurrent callers cannot overrun the request budget.
     * A granted slot counts against the window whether or not the call succeeds.
     */
    public Permit tryAcquire(ProviderId provider) {
        return windows.get(provider).tryAcquire(provider, clock.instant());
    }

    /**
     * Charge the tokens a completed call consumed to its reserved slot.
     *
     * @return window status after the charge
     */
    public RateLimitStatus complete(Permit permit, long tokens) {
        if (!permit.isGranted()) {
            throw new IllegalArgumentException("Cannot complete a denied permit for " + permit.provider);
        }
        RateLimitStatus status = windows.get(permit.provider)
                .charge(permit.provider, permit.usage, clock.instant(), Math.max(0, tokens));
        warnIfApproaching(status);
        return status;
    }

    /**
     * Record a finished request without a prior reservation.
     */
    public RateLimitStatus recordRequest(ProviderId provider, long tokens) {
        Window providerWindow = windows.get(provider);
        RateLimitStatus status = providerWindow.record(provider, clock.instant(), Math.max(0, tokens));
        warnIfApproaching(status);
        return status;
    }

    public List<RateLimitStatus> snapshot() {
        Instant now = clock.instant();
        List<RateLimitStatus> statuses = new ArrayList<>(windows.size());
        windows.forEach((id, providerWindow) -> statuses.add(providerWindow.status(id, now)));
        return statuses;
    }

    private void warnIfApproaching(RateLimitStatus status) {
        if (status.isApproaching()) {
            log.warn("Provider {} approaching rate limit: {}/{} requests, {}/{} tokens",
                    status.getProvider(), status.getRequests(), status.getRequestsLimit(),
                    status.getTokens(), status.getTokensLimit());
        }
    }

    /**
     * Outcome of {@link #tryAcquire}: either a reserved slot or the status that denied it.
     */
    public static final class Permit {

        private final ProviderId provider;
        private final RateLimitStatus status;
        private final Usage usage;

        private Permit(ProviderId provider, RateLimitStatus status, Usage usage) {
            this.provider = provider;
            this.status = status;
            this.usage = usage;
        }

        public boolean isGranted() {
            return usage != null;
        }

        /**
         * Window status at acquisition time, including the reserved slot when granted.
         */
        public RateLimitStatus getStatus() {
            return status;
        }
    }

    private final class Window {

        private final int requestLimit;
        private final long tokenLimit;
        private final Deque<Usage> entries = new ArrayDeque<>();
        private long tokens;

        Window(int requestLimit, long tokenLimit) {
            this.requestLimit = requestLimit;
            this.tokenLimit = tokenLimit;
        }

        synchronized RateLimitStatus status(ProviderId provider, Instant now) {
            evict(now);
            return toStatus(provider);
        }

        synchronized RateLimitStatus record(ProviderId provider, Instant now, long tokenCount) {
            evict(now);
            Usage usage = new Usage(now);
            usage.tokens = tokenCount;
            entries.addLast(usage);
            tokens += tokenCount;
            return toStatus(provider);
        }

        synchronized Permit tryAcquire(ProviderId provider, Instant now) {
            evict(now);
            RateLimitStatus current = toStatus(provider);
            if (current.isBlocked()) {
                return new Permit(provider, current, null);
            }
            Usage usage = new Usage(now);
            entries.addLast(usage);
            return new Permit(provider, toStatus(provider), usage);
        }

        synchronized RateLimitStatus charge(ProviderId provider, Usage usage, Instant now, long tokenCount) {
            evict(now);
            // The slot may already have slid out of the window during a long call
            if (!usage.evicted) {
                usage.tokens += tokenCount;
                tokens += tokenCount;
            }
            return toStatus(provider);
        }

        private void evict(Instant now) {
            Instant cutoff = now.minus(window);
            while (!entries.isEmpty() && !entries.peekFirst().at.isAfter(cutoff)) {
                Usage expired = entries.removeFirst();
                expired.evicted = true;
                tokens -= expired.tokens;
            }
        }

        private RateLimitStatus toStatus(ProviderId provider) {
            int requests = entries.size();
            boolean blocked = (requestLimit > 0 && requests >= requestLimit)
                    || (tokenLimit > 0 && tokens >= tokenLimit);
            boolean approaching = (requestLimit > 0 && requests >= requestLimit * approachingRatio)
                    || (tokenLimit > 0 && tokens >= tokenLimit * approachingRatio);

            return RateLimitStatus.builder()
                    .provider(provider)
                    .status(blocked ? RateLimitStatus.Status.BLOCKED : RateLimitStatus.Status.OK)
                    .requests(requests)
                    .requestsLimit(requestLimit)
                    .tokens(tokens)
                    .tokensLimit(tokenLimit)
                    .approaching(approaching)
                    .build();
        }
    }

    /**
     * One request in a window. Mutated only under the owning window's lock.
     */
    private static final class Usage {

        private final Instant at;
        private long tokens;
        private boolean evicted;

        private Usage(Instant at) {
            this.at = at;
        }
    }
}

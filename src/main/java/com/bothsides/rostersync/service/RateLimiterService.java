package com.bothsides.rostersync.service;

import com.bothsides.rostersync.model.RateLimitConfig;
import com.bothsides.rostersync.model.RateLimitDecision;
import com.bothsides.rostersync.model.RateLimitStatus;
import com.bothsides.rostersync.model.RateLimitTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-integration fixed-window admission control.
 *
 * <p>Counts admissions in the current wall-clock minute and hour buckets.
 * A caller may get up to twice the limit across a bucket boundary.
 * Trackers are process-local.
 */
@Service
public class RateLimiterService {

    private static final Logger logger = LoggerFactory.getLogger(RateLimiterService.class);

    private static final long MINUTE_MS = 60_000L;
    private static final long HOUR_MS = 3_600_000L;

    private final Clock clock;
    private final Map<String, RateLimitTracker> trackers = new ConcurrentHashMap<>();
    private final Map<String, RateLimitConfig> limitsByIntegration = new ConcurrentHashMap<>();

    @Autowired
    public RateLimiterService(Clock clock) {
        this.clock = clock;
    }

    /**
     * Admit one job for the integration, or reject it with the time the blocking window ends
     */
    public Mono<RateLimitDecision> tryAcquire(String integrationId, RateLimitConfig limits) {
        return Mono.fromSupplier(() -> decide(integrationId, limits));
    }

    private RateLimitDecision decide(String integrationId, RateLimitConfig limits) {
        Instant now = clock.instant();
        long currentMinute = Math.floorDiv(now.toEpochMilli(), MINUTE_MS);
        long currentHour = Math.floorDiv(now.toEpochMilli(), HOUR_MS);
        RateLimitDecision[] decision = new RateLimitDecision[1];

        trackers.compute(integrationId, (id, existing) -> {
            limitsByIntegration.put(id, limits);
            RateLimitTracker tracker = existing != null
                    ? existing : new RateLimitTracker(currentMinute, currentHour, now);
            synchronized (tracker) {
                tracker.roll(currentMinute, currentHour);

                if (tracker.getMinuteCount() >= limits.requestsPerMinute()) {
                    Instant next = Instant.ofEpochMilli((currentMinute + 1) * MINUTE_MS);
                    tracker.setNextAvailableTime(next);
                    decision[0] = RateLimitDecision.reject(next);
                } else if (tracker.getHourCount() >= limits.requestsPerHour()) {
                    Instant next = Instant.ofEpochMilli((currentHour + 1) * HOUR_MS);
                    tracker.setNextAvailableTime(next);
                    decision[0] = RateLimitDecision.reject(next);
                } else {
                    tracker.increment();
                    decision[0] = RateLimitDecision.allow();
                }
            }
            return tracker;
        });

        if (decision[0].allowed()) {
            logger.debug("Admitted job for integration {}", integrationId);
        } else {
            logger.warn("Rate limit reached for integration {}, next available at {}",
                    integrationId, decision[0].nextAvailableTime());
        }
        return decision[0];
    }

    /**
     * Snapshot of every live tracker, keyed by integration
     */
    public Map<String, RateLimitStatus> getStatusSnapshot() {
        Map<String, RateLimitStatus> snapshot = new TreeMap<>();
        trackers.forEach((integrationId, tracker) -> {
            synchronized (tracker) {
                snapshot.put(integrationId, tracker.snapshot(limitsByIntegration.get(integrationId)));
            }
        });
        return snapshot;
    }

    /**
     * Drop trackers whose hour bucket has passed. Both of their counters
     * would reset on the next admission, so no decision changes.
     *
     * @return the number of trackers removed
     */
    public int evictIdleTrackers() {
        long currentHour = Math.floorDiv(clock.instant().toEpochMilli(), HOUR_MS);
        int[] evicted = new int[1];
        for (String integrationId : trackers.keySet()) {
            trackers.computeIfPresent(integrationId, (id, tracker) -> {
                synchronized (tracker) {
                    if (tracker.getLastHour() < currentHour) {
                        evicted[0]++;
                        limitsByIntegration.remove(id);
                        return null;
                    }
                    return tracker;
                }
            });
        }
        if (evicted[0] > 0) {
            logger.debug("Evicted {} idle rate limit trackers", evicted[0]);
        }
        return evicted[0];
    }
}

package com.bothsides.rostersync.service;

import com.bothsides.rostersync.model.RateLimitConfig;
import com.bothsides.rostersync.model.RateLimitDecision;
import com.bothsides.rostersync.model.RateLimitStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RateLimiterServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:15:30Z");

    @Mock
    private Clock clock;

    private RateLimiterService rateLimiter;

    @BeforeEach
    void setUp() {
        when(clock.instant()).thenReturn(NOW);
        rateLimiter = new RateLimiterService(clock);
    }

    @Test
    void shouldRejectOnceMinuteLimitIsReached() {
        RateLimitConfig limits = RateLimitConfig.defaults();

        for (int i = 0; i < 60; i++) {
            assertThat(rateLimiter.tryAcquire("school-A", limits).block().allowed()).isTrue();
        }

        StepVerifier.create(rateLimiter.tryAcquire("school-A", limits))
                .assertNext(decision -> {
                    assertThat(decision.allowed()).isFalse();
                    assertThat(decision.nextAvailableTime()).isEqualTo(Instant.parse("2026-03-02T10:16:00Z"));
                })
                .verifyComplete();
    }

    @Test
    void shouldAdmitAgainInNextMinute() {
        RateLimitConfig limits = new RateLimitConfig(2, 100);
        rateLimiter.tryAcquire("school-A", limits).block();
        rateLimiter.tryAcquire("school-A", limits).block();
        assertThat(rateLimiter.tryAcquire("school-A", limits).block().allowed()).isFalse();

        when(clock.instant()).thenReturn(Instant.parse("2026-03-02T10:16:00Z"));

        assertThat(rateLimiter.tryAcquire("school-A", limits).block().allowed()).isTrue();
    }

    @Test
    void shouldRejectOnceHourLimitIsReachedUntilNextHour() {
        RateLimitConfig limits = new RateLimitConfig(100, 3);
        for (int i = 0; i < 3; i++) {
            when(clock.instant()).thenReturn(NOW.plusSeconds(60L * i));
            assertThat(rateLimiter.tryAcquire("school-A", limits).block().allowed()).isTrue();
        }

        RateLimitDecision decision = rateLimiter.tryAcquire("school-A", limits).block();

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.nextAvailableTime()).isEqualTo(Instant.parse("2026-03-02T11:00:00Z"));
    }

    @Test
    void shouldTrackIntegrationsIndependently() {
        RateLimitConfig limits = new RateLimitConfig(1, 10);
        assertThat(rateLimiter.tryAcquire("school-A", limits).block().allowed()).isTrue();
        assertThat(rateLimiter.tryAcquire("school-A", limits).block().allowed()).isFalse();

        assertThat(rateLimiter.tryAcquire("school-B", limits).block().allowed()).isTrue();
    }

    @Test
    void shouldNotCountRejectedRequests() {
        RateLimitConfig limits = new RateLimitConfig(1, 10);
        rateLimiter.tryAcquire("school-A", limits).block();
        rateLimiter.tryAcquire("school-A", limits).block();
        rateLimiter.tryAcquire("school-A", limits).block();

        RateLimitStatus status = rateLimiter.getStatusSnapshot().get("school-A");

        assertThat(status.getMinuteCount()).isEqualTo(1);
        assertThat(status.getHourCount()).isEqualTo(1);
        assertThat(status.getRequestsPerMinute()).isEqualTo(1);
        assertThat(status.getNextAvailableTime()).isEqualTo(Instant.parse("2026-03-02T10:16:00Z"));
        assertThat(status.isExceeded()).isTrue();
    }

    @Test
    void shouldEvictTrackersIdleForMoreThanAnHour() {
        rateLimiter.tryAcquire("school-A", RateLimitConfig.defaults()).block();
        assertThat(rateLimiter.evictIdleTrackers()).isZero();

        when(clock.instant()).thenReturn(Instant.parse("2026-03-02T11:00:01Z"));
        rateLimiter.tryAcquire("school-B", RateLimitConfig.defaults()).block();

        assertThat(rateLimiter.evictIdleTrackers()).isEqualTo(1);
        Map<String, RateLimitStatus> snapshot = rateLimiter.getStatusSnapshot();
        assertThat(snapshot).containsOnlyKeys("school-B");
    }
}

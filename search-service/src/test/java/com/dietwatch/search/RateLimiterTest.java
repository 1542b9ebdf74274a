package com.dietwatch.search;

import com.dietwatch.search.exception.RateLimitExceededException;
import com.dietwatch.search.resilience.RateLimiter;
import io.github.bucket4j.TimeMeter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateLimiterTest {

    private static final long SECOND = 1_000_000_000L;

    private final FakeTime time = new FakeTime();

    @Test
    void testNeverGrantsMoreThanCapacityInAnyRollingWindow() {
        RateLimiter limiter = limiter(5, Duration.ofSeconds(1), Duration.ofSeconds(2), 50);
        List<Long> grants = new ArrayList<>();

        for (int i = 0; i < 23; i++) {
            limiter.acquire();
            grants.add(time.currentTimeNanos());
            if (i == 11) {
                time.advance(3 * SECOND);
            }
        }

        for (int i = 5; i < grants.size(); i++) {
            assertThat(grants.get(i) - grants.get(i - 5))
                    .as("grant %d vs grant %d", i, i - 5)
                    .isGreaterThanOrEqualTo(SECOND);
        }
    }

    @Test
    void testBurstUpToCapacityWithoutWaiting() {
        RateLimiter limiter = limiter(5, Duration.ofSeconds(1), Duration.ofSeconds(2), 50);

        for (int i = 0; i < 5; i++) {
            limiter.acquire();
        }

        assertThat(time.slept.get()).isZero();
    }

    @Test
    void testSixthPermitWaitsForWindowToRoll() {
        RateLimiter limiter = limiter(5, Duration.ofSeconds(1), Duration.ofSeconds(2), 50);
        for (int i = 0; i < 5; i++) {
            limiter.acquire();
        }

        limiter.acquire();

        assertThat(time.slept.get()).isGreaterThanOrEqualTo(SECOND).isLessThanOrEqualTo(SECOND + SECOND / 5);
    }

    @Test
    void testRejectsWhenWaitExceedsMaxWait() {
        RateLimiter limiter = limiter(1, Duration.ofSeconds(5), Duration.ofSeconds(2), 50);
        limiter.acquire();

        assertThatThrownBy(limiter::acquire)
                .isInstanceOf(RateLimitExceededException.class)
                .satisfies(ex -> assertThat(((RateLimitExceededException) ex).getSuggestedWait())
                        .isGreaterThan(Duration.ofSeconds(2)));
        assertThat(limiter.queueDepth()).isZero();
    }

    @Test
    void testRejectsWhenWaitQueueIsFull() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        RateLimiter limiter = new RateLimiter(
                1, Duration.ofSeconds(1), Duration.ofSeconds(2), 0, Duration.ofSeconds(30),
                time, time::sleep, registry
        );
        limiter.acquire();

        assertThatThrownBy(limiter::acquire).isInstanceOf(RateLimitExceededException.class);
        assertThat(time.slept.get()).isZero();
        assertThat(registry.counter("structured_store_rate_limit_rejected_total").count()).isEqualTo(1.0);
    }

    @Test
    void testThrottleHalvesRateForCooldownThenRestores() {
        RateLimiter limiter = limiter(5, Duration.ofSeconds(1), Duration.ofSeconds(2), 50);
        assertThat(limiter.currentRate()).isEqualTo(5.0);

        limiter.onThrottled(null);

        assertThat(limiter.isCoolingDown()).isTrue();
        assertThat(limiter.currentRate()).isEqualTo(2.5);

        time.advance(29 * SECOND);
        assertThat(limiter.isCoolingDown()).isTrue();

        time.advance(SECOND);
        assertThat(limiter.isCoolingDown()).isFalse();
        assertThat(limiter.currentRate()).isEqualTo(5.0);
    }

    @Test
    void testLongerRetryAfterExtendsCooldown() {
        RateLimiter limiter = limiter(5, Duration.ofSeconds(1), Duration.ofSeconds(2), 50);

        limiter.onThrottled(Duration.ofSeconds(60));
        time.advance(45 * SECOND);

        assertThat(limiter.isCoolingDown()).isTrue();
        time.advance(15 * SECOND);
        assertThat(limiter.isCoolingDown()).isFalse();
    }

    @Test
    void testRefillIsSlowerWhileCoolingDown() {
        RateLimiter limiter = limiter(5, Duration.ofSeconds(1), Duration.ofSeconds(5), 50);
        limiter.onThrottled(null);
        for (int i = 0; i < 5; i++) {
            limiter.acquire();
        }
        long before = time.slept.get();

        for (int i = 0; i < 5; i++) {
            limiter.acquire();
        }

        // five tokens at half rate take two seconds to refill
        assertThat(time.slept.get() - before).isGreaterThanOrEqualTo(2 * SECOND - SECOND / 10);
    }

    @Test
    void testInterruptedWaitIsRejected() {
        RateLimiter limiter = new RateLimiter(
                1, Duration.ofSeconds(1), Duration.ofSeconds(2), 10, Duration.ofSeconds(30),
                time, nanos -> {
                    throw new InterruptedException("stop");
                }, null
        );
        limiter.acquire();

        try {
            assertThatThrownBy(limiter::acquire).isInstanceOf(RateLimitExceededException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void testRejectsInvalidCost() {
        RateLimiter limiter = limiter(5, Duration.ofSeconds(1), Duration.ofSeconds(2), 50);

        assertThatThrownBy(() -> limiter.acquire(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> limiter.acquire(6)).isInstanceOf(IllegalArgumentException.class);
    }

    private RateLimiter limiter(int capacity, Duration period, Duration maxWait, int maxQueue) {
        return new RateLimiter(capacity, period, maxWait, maxQueue, Duration.ofSeconds(30), time, time::sleep, null);
    }

    private static final class FakeTime implements TimeMeter {
        private final AtomicLong nanos = new AtomicLong(SECOND);
        private final AtomicLong slept = new AtomicLong();

        @Override
        public long currentTimeNanos() {
            return nanos.get();
        }

        @Override
        public boolean isWallClockBased() {
            return false;
        }

        void advance(long delta) {
            nanos.addAndGet(delta);
        }

        void sleep(long delta) {
            slept.addAndGet(delta);
            advance(delta);
        }
    }
}

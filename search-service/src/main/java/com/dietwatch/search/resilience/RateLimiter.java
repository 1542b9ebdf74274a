package com.dietwatch.search.resilience;

import com.dietwatch.search.exception.RateLimitExceededException;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.BucketConfiguration;
import io.github.bucket4j.ConsumptionProbe;
import io.github.bucket4j.Refill;
import io.github.bucket4j.TimeMeter;
import io.github.bucket4j.TokensInheritanceStrategy;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-wide limiter for outbound structured-store calls.
 *
 * <p>A Bucket4j token bucket provides the refill rate and is halved while cooling down after an
 * upstream 429. A log of the last {@code capacity} grant times additionally guarantees that no
 * rolling window of one refill period ever sees more than {@code capacity} grants, including the
 * burst that follows an idle period.
 */
public class RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);
    private static final long NEVER = Long.MIN_VALUE / 4;

    private final int capacity;
    private final Duration refillPeriod;
    private final Duration maxWait;
    private final int maxQueueDepth;
    private final Duration cooldown;
    private final TimeMeter timeMeter;
    private final Sleeper sleeper;
    private final MeterRegistry meterRegistry;
    private final Bucket bucket;
    private final long[] grantLog;
    private final AtomicInteger waiters = new AtomicInteger();
    private int grantCursor;
    private long cooldownUntilNanos = NEVER;
    private boolean coolingDown;

    public RateLimiter(int capacity, Duration refillPeriod, Duration maxWait, int maxQueueDepth, Duration cooldown) {
        this(capacity, refillPeriod, maxWait, maxQueueDepth, cooldown, TimeMeter.SYSTEM_NANOTIME,
                nanos -> TimeUnit.NANOSECONDS.sleep(nanos), null);
    }

    public RateLimiter(
            int capacity,
            Duration refillPeriod,
            Duration maxWait,
            int maxQueueDepth,
            Duration cooldown,
            TimeMeter timeMeter,
            Sleeper sleeper,
            MeterRegistry meterRegistry
    ) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.refillPeriod = refillPeriod;
        this.maxWait = maxWait;
        this.maxQueueDepth = Math.max(0, maxQueueDepth);
        this.cooldown = cooldown;
        this.timeMeter = timeMeter;
        this.sleeper = sleeper;
        this.meterRegistry = meterRegistry;
        this.bucket = Bucket.builder()
                .addLimit(bandwidth(refillPeriod))
                .withCustomTimePrecision(timeMeter)
                .build();
        this.grantLog = new long[capacity];
        Arrays.fill(grantLog, NEVER);
    }

    public void acquire() {
        acquire(1);
    }

    /**
     * Blocks until {@code cost} permits are granted.
     *
     * @throws RateLimitExceededException when too many callers are already waiting or the permits
     *                                    cannot be granted within the max wait
     */
    public void acquire(int cost) {
        if (cost <= 0 || cost > capacity) {
            throw new IllegalArgumentException("cost must be between 1 and " + capacity);
        }
        long start = timeMeter.currentTimeNanos();
        long deadline = start + maxWait.toNanos();
        long waitNanos = tryGrant(cost);
        if (waitNanos == 0L) {
            return;
        }
        if (waiters.incrementAndGet() > maxQueueDepth) {
            waiters.decrementAndGet();
            incrementCounter("structured_store_rate_limit_rejected_total");
            throw new RateLimitExceededException(
                    "rate limiter queue is full (max_queue=" + maxQueueDepth + ")",
                    Duration.ofNanos(waitNanos)
            );
        }
        try {
            while (waitNanos > 0L) {
                long now = timeMeter.currentTimeNanos();
                if (now + waitNanos > deadline) {
                    incrementCounter("structured_store_rate_limit_rejected_total");
                    throw new RateLimitExceededException(
                            "permit not available within " + maxWait.toMillis() + "ms",
                            Duration.ofNanos(waitNanos)
                    );
                }
                try {
                    sleeper.sleep(waitNanos);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    throw new RateLimitExceededException("interrupted while waiting for a permit", Duration.ofNanos(waitNanos));
                }
                waitNanos = tryGrant(cost);
            }
            recordWait(start);
        } finally {
            waiters.decrementAndGet();
        }
    }

    /**
     * Called when the upstream answered 429 despite local limiting. Halves the refill rate until the
     * cooldown (or the upstream's Retry-After, whichever is longer) has elapsed.
     */
    public synchronized void onThrottled(Duration retryAfter) {
        Duration window = retryAfter != null && retryAfter.compareTo(cooldown) > 0 ? retryAfter : cooldown;
        long until = timeMeter.currentTimeNanos() + window.toNanos();
        cooldownUntilNanos = Math.max(cooldownUntilNanos, until);
        incrementCounter("structured_store_throttled_total");
        if (!coolingDown) {
            coolingDown = true;
            bucket.replaceConfiguration(configuration(refillPeriod.multipliedBy(2)), TokensInheritanceStrategy.AS_IS);
            log.warn("event=rate_limit_cooldown_start rate_per_sec={} cooldown_ms={}", currentRate(), window.toMillis());
        }
    }

    /**
     * Effective refill rate in permits per second.
     */
    public synchronized double currentRate() {
        Duration period = coolingDown ? refillPeriod.multipliedBy(2) : refillPeriod;
        return capacity * 1_000_000_000.0 / period.toNanos();
    }

    public synchronized boolean isCoolingDown() {
        restoreIfCooledDown(timeMeter.currentTimeNanos());
        return coolingDown;
    }

    public int queueDepth() {
        return waiters.get();
    }

    private synchronized long tryGrant(int cost) {
        long now = timeMeter.currentTimeNanos();
        restoreIfCooledDown(now);
        // the cost-th oldest grant must have left the window before cost more can be granted
        long boundary = grantLog[(grantCursor + cost - 1) % capacity] + refillPeriod.toNanos();
        if (boundary > now) {
            return boundary - now;
        }
        ConsumptionProbe probe = bucket.tryConsumeAndReturnRemaining(cost);
        if (!probe.isConsumed()) {
            return Math.max(1L, probe.getNanosToWaitForRefill());
        }
        for (int i = 0; i < cost; i++) {
            grantLog[grantCursor] = now;
            grantCursor = (grantCursor + 1) % capacity;
        }
        return 0L;
    }

    private void restoreIfCooledDown(long now) {
        if (coolingDown && now >= cooldownUntilNanos) {
            coolingDown = false;
            bucket.replaceConfiguration(configuration(refillPeriod), TokensInheritanceStrategy.AS_IS);
            log.info("event=rate_limit_cooldown_end rate_per_sec={}", currentRate());
        }
    }

    private BucketConfiguration configuration(Duration period) {
        return BucketConfiguration.builder()
                .addLimit(bandwidth(period))
                .build();
    }

    private Bandwidth bandwidth(Duration period) {
        return Bandwidth.classic(capacity, Refill.greedy(capacity, period));
    }

    private void recordWait(long startNanos) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.timer("structured_store_rate_limit_wait")
                .record(timeMeter.currentTimeNanos() - startNanos, TimeUnit.NANOSECONDS);
    }

    private void incrementCounter(String metricName) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.counter(metricName).increment();
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long nanos) throws InterruptedException;
    }
}

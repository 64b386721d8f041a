package com.phillippitts.voicenotes.service.ratelimit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.Objects;

/**
 * Token bucket: holds up to {@code maxTokens} tokens, refilled continuously at
 * {@code refillRatePerSecond}. Refill is computed lazily from the injected {@link Clock}
 * before every read, so the bucket has no timer thread.
 *
 * <p>Thread-safe: all state transitions are {@code synchronized} so a replay sweep running
 * several pipelines at once sees atomic check-and-decrement.
 */
public final class TokenBucketRateLimiter implements RateLimiter {

    private static final Logger LOG = LogManager.getLogger(TokenBucketRateLimiter.class);

    private final String endpoint;
    private final Clock clock;
    private final int maxTokens;
    private final double refillRatePerSecond;

    private double tokens;
    private long lastRefillMillis;

    public TokenBucketRateLimiter(String endpoint, int maxTokens, double refillRatePerSecond, Clock clock) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive, got: " + maxTokens);
        }
        if (!(refillRatePerSecond > 0)) {
            throw new IllegalArgumentException("refillRatePerSecond must be positive, got: " + refillRatePerSecond);
        }
        this.maxTokens = maxTokens;
        this.refillRatePerSecond = refillRatePerSecond;
        this.tokens = maxTokens;
        this.lastRefillMillis = clock.millis();
    }

    @Override
    public synchronized boolean acquire(int cost) {
        if (cost <= 0) {
            LOG.warn("Rejected token request for endpoint={}: cost must be positive (cost={})", endpoint, cost);
            return false;
        }
        if (cost > maxTokens) {
            LOG.warn("Rejected token request for endpoint={}: cost {} exceeds bucket capacity {}",
                    endpoint, cost, maxTokens);
            return false;
        }

        refill();

        if (tokens >= cost) {
            tokens -= cost;
            LOG.debug("Admitted endpoint={} cost={} remaining={}", endpoint, cost, tokens);
            return true;
        }
        LOG.debug("Refused endpoint={} cost={} available={}", endpoint, cost, tokens);
        return false;
    }

    @Override
    public synchronized long getTimeUntilTokensAvailable(int requested) {
        refill();
        if (tokens >= requested) {
            return 0L;
        }
        double deficit = requested - tokens;
        return (long) Math.ceil(deficit / refillRatePerSecond * 1000.0);
    }

    @Override
    public synchronized int getAvailableTokens() {
        refill();
        return (int) Math.floor(tokens);
    }

    @Override
    public synchronized void reset() {
        tokens = maxTokens;
        lastRefillMillis = clock.millis();
    }

    @Override
    public String endpoint() {
        return endpoint;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public double getRefillRatePerSecond() {
        return refillRatePerSecond;
    }

    private void refill() {
        long now = clock.millis();
        long elapsedMillis = Math.max(0L, now - lastRefillMillis);
        if (elapsedMillis == 0L) {
            return;
        }
        tokens = Math.min(maxTokens, tokens + (elapsedMillis / 1000.0) * refillRatePerSecond);
        lastRefillMillis = now;
    }
}

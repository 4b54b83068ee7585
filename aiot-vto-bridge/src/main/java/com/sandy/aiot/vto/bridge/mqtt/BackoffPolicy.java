package com.sandy.aiot.vto.bridge.mqtt;

import com.sandy.aiot.vto.bridge.config.BridgeProperties;

import java.time.Duration;
import java.util.Random;

/**
 * Multiplicative backoff with a cap. Each delay handed out is the current interval scaled by
 * a random factor in {@code [jitterMin, jitterMax)}; the interval itself only moves through
 * {@link #grow()} and {@link #reset()}.
 */
public class BackoffPolicy {

    private final long baseMs;
    private final long maxMs;
    private final double multiplier;
    private final double jitterMin;
    private final double jitterMax;
    private final Random random;

    private long currentMs;

    public BackoffPolicy(Duration base, Duration max, double multiplier,
                         double jitterMin, double jitterMax, Random random) {
        if (base.isNegative() || base.isZero()) {
            throw new IllegalArgumentException("base interval must be positive");
        }
        if (max.compareTo(base) < 0) {
            throw new IllegalArgumentException("max interval must not be below base interval");
        }
        if (jitterMax < jitterMin) {
            throw new IllegalArgumentException("jitterMax must not be below jitterMin");
        }
        this.baseMs = base.toMillis();
        this.maxMs = max.toMillis();
        this.multiplier = multiplier;
        this.jitterMin = jitterMin;
        this.jitterMax = jitterMax;
        this.random = random;
        this.currentMs = baseMs;
    }

    public static BackoffPolicy from(BridgeProperties.Reconnect settings) {
        return new BackoffPolicy(settings.getBaseInterval(), settings.getMaxInterval(), settings.getMultiplier(),
                settings.getJitterMin(), settings.getJitterMax(), new Random());
    }

    public synchronized Duration nextDelay() {
        double factor = jitterMin + random.nextDouble() * (jitterMax - jitterMin);
        return Duration.ofMillis(Math.round(currentMs * factor));
    }

    public synchronized void grow() {
        long next = Math.round(currentMs * multiplier);
        if (multiplier > 1.0) {
            next = Math.max(next, currentMs + 1);
        }
        currentMs = Math.min(next, maxMs);
    }

    public synchronized void reset() {
        currentMs = baseMs;
    }

    public synchronized Duration current() {
        return Duration.ofMillis(currentMs);
    }
}

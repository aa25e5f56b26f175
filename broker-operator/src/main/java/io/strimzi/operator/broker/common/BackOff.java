/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.operator.broker.common;

import java.util.Random;

/**
 * Exponential back-off with jitter and a fixed number of attempts.
 *
 * <p>Attempts are numbered from 0. After a failed attempt {@code n} (other than the last one) the caller waits
 * {@link #delayMs(int)}, which is {@code initialDelayMs * factor^n} stretched by a random fraction in
 * {@code [0, jitter)}. With {@code maxAttempts} attempts there are {@code maxAttempts - 1} waits, so the total time
 * spent waiting is never more than {@link #maxTotalDelayMs()}, whatever the random draws are.</p>
 *
 * <p>The defaults (10 attempts, 5s initial delay, factor 1.2, jitter 1.0) wait about 104 seconds in total without
 * jitter and never more than about 208 seconds.</p>
 *
 * <p>Instances are immutable and can be shared.</p>
 */
public class BackOff {
    /**
     * Default number of attempts
     */
    public static final int DEFAULT_MAX_ATTEMPTS = 10;

    /**
     * Default delay after the first failed attempt
     */
    public static final long DEFAULT_INITIAL_DELAY_MS = 5_000L;

    /**
     * Default growth factor of the delay
     */
    public static final double DEFAULT_FACTOR = 1.2;

    /**
     * Default jitter
     */
    public static final double DEFAULT_JITTER = 1.0;

    private final long initialDelayMs;
    private final double factor;
    private final double jitter;
    private final int maxAttempts;
    private final Random random;

    /**
     * Creates a back-off with the default attempts, delay, factor and jitter.
     */
    public BackOff() {
        this(DEFAULT_INITIAL_DELAY_MS, DEFAULT_FACTOR, DEFAULT_JITTER, DEFAULT_MAX_ATTEMPTS);
    }

    /**
     * Constructor
     *
     * @param initialDelayMs    Delay after the first failed attempt
     * @param factor            Growth factor of the delay, must be greater than 1
     * @param jitter            Maximum random stretch of each delay as a fraction of it, must not be negative
     * @param maxAttempts       Number of attempts, must be at least 1
     */
    public BackOff(long initialDelayMs, double factor, double jitter, int maxAttempts) {
        this(initialDelayMs, factor, jitter, maxAttempts, new Random());
    }

    /**
     * Constructor
     *
     * @param initialDelayMs    Delay after the first failed attempt
     * @param factor            Growth factor of the delay, must be greater than 1
     * @param jitter            Maximum random stretch of each delay as a fraction of it, must not be negative
     * @param maxAttempts       Number of attempts, must be at least 1
     * @param random            Source of the jitter
     */
    public BackOff(long initialDelayMs, double factor, double jitter, int maxAttempts, Random random) {
        if (initialDelayMs <= 0) {
            throw new IllegalArgumentException("initialDelayMs must be positive");
        }
        if (factor <= 1.0) {
            throw new IllegalArgumentException("factor must be greater than 1");
        }
        if (jitter < 0.0) {
            throw new IllegalArgumentException("jitter must not be negative");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }

        this.initialDelayMs = initialDelayMs;
        this.factor = factor;
        this.jitter = jitter;
        this.maxAttempts = maxAttempts;
        this.random = random;
    }

    /**
     * @return  The number of attempts
     */
    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Checks whether another attempt is allowed after the given one failed.
     *
     * @param attempt   Index of the attempt which just failed
     *
     * @return  True if the attempt was the last one
     */
    public boolean done(int attempt) {
        return attempt + 1 >= maxAttempts;
    }

    /**
     * Calculates how long to wait after the given attempt failed.
     *
     * @param attempt   Index of the attempt which just failed
     *
     * @return  Delay in milliseconds
     */
    public long delayMs(int attempt) {
        double base = nominalDelay(attempt);
        return (long) (base + base * jitter * random.nextDouble());
    }

    /**
     * @return  Total wait time in milliseconds when no jitter is applied
     */
    public long nominalTotalDelayMs() {
        double total = 0;
        for (int attempt = 0; attempt < maxAttempts - 1; attempt++) {
            total += nominalDelay(attempt);
        }
        return (long) total;
    }

    /**
     * @return  Upper bound of the total wait time in milliseconds, reached only when every jitter draw is maximal
     */
    public long maxTotalDelayMs() {
        double total = 0;
        for (int attempt = 0; attempt < maxAttempts - 1; attempt++) {
            total += nominalDelay(attempt) * (1.0 + jitter);
        }
        return (long) Math.ceil(total);
    }

    private double nominalDelay(int attempt) {
        return initialDelayMs * Math.pow(factor, attempt);
    }

    @Override
    public String toString() {
        return "BackOff("
                + "initialDelayMs=" + initialDelayMs
                + ", factor=" + factor
                + ", jitter=" + jitter
                + ", maxAttempts=" + maxAttempts
                + ")";
    }
}

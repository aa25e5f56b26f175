/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.operator.broker.common;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class BackOffTest {
    @Test
    public void testDefaults() {
        BackOff backOff = new BackOff();

        assertThat(backOff.maxAttempts(), is(10));
        // 5000 * (1.2^9 - 1) / 0.2
        assertThat(backOff.nominalTotalDelayMs(), is(103_994L));
        assertThat(backOff.maxTotalDelayMs(), is(207_990L));
    }

    @Test
    public void testDone() {
        BackOff backOff = new BackOff(10, 2.0, 0.0, 3);

        assertThat(backOff.done(0), is(false));
        assertThat(backOff.done(1), is(false));
        assertThat(backOff.done(2), is(true));
    }

    @Test
    public void testDelaysWithoutJitter() {
        BackOff backOff = new BackOff(100, 2.0, 0.0, 5);

        assertThat(backOff.delayMs(0), is(100L));
        assertThat(backOff.delayMs(1), is(200L));
        assertThat(backOff.delayMs(3), is(800L));
        assertThat(backOff.nominalTotalDelayMs(), is(1_500L));
    }

    @Test
    public void testJitteredDelaysStayWithinTheBound() {
        Random maximal = new Random() {
            private static final long serialVersionUID = 1L;

            @Override
            public double nextDouble() {
                return Math.nextDown(1.0);
            }
        };

        for (Random random : new Random[] {new Random(42), new Random(7), maximal}) {
            BackOff backOff = new BackOff(5_000, 1.2, 1.0, 10, random);

            long total = 0;
            for (int attempt = 0; !backOff.done(attempt); attempt++) {
                long delay = backOff.delayMs(attempt);
                assertThat(delay, greaterThanOrEqualTo((long) (5_000 * Math.pow(1.2, attempt))));
                total += delay;
            }

            assertThat(total, lessThanOrEqualTo(backOff.maxTotalDelayMs()));
            assertThat(total, greaterThanOrEqualTo(backOff.nominalTotalDelayMs() - 9));
        }
    }

    @Test
    public void testSingleAttemptNeverWaits() {
        BackOff backOff = new BackOff(5_000, 1.2, 1.0, 1);

        assertThat(backOff.done(0), is(true));
        assertThat(backOff.maxTotalDelayMs(), is(0L));
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new BackOff(0, 1.2, 1.0, 10));
        assertThrows(IllegalArgumentException.class, () -> new BackOff(100, 1.0, 1.0, 10));
        assertThrows(IllegalArgumentException.class, () -> new BackOff(100, 1.2, -1.0, 10));
        assertThrows(IllegalArgumentException.class, () -> new BackOff(100, 1.2, 1.0, 0));
    }
}

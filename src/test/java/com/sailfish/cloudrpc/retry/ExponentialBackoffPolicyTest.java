package com.sailfish.cloudrpc.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class ExponentialBackoffPolicyTest {

    @Test
    void growsExponentiallyUpToTheCap() {
        ExponentialBackoffPolicy policy = new ExponentialBackoffPolicy(Duration.ofMillis(100), 2.0, Duration.ofSeconds(1), 0.0);
        Random random = new Random(1);

        assertEquals(Duration.ofMillis(100), policy.nextDelay(1, random));
        assertEquals(Duration.ofMillis(200), policy.nextDelay(2, random));
        assertEquals(Duration.ofMillis(400), policy.nextDelay(3, random));
        assertEquals(Duration.ofMillis(800), policy.nextDelay(4, random));
        assertEquals(Duration.ofSeconds(1), policy.nextDelay(5, random));
        assertEquals(Duration.ofSeconds(1), policy.nextDelay(60, random));
    }

    @Test
    void jitteredDelaysStayWithinBounds() {
        ExponentialBackoffPolicy policy = new ExponentialBackoffPolicy(Duration.ofMillis(50), 3.0, Duration.ofSeconds(2), 0.5);
        Random random = new Random(42);

        for (int attempt = 1; attempt <= 30; attempt++) {
            for (int i = 0; i < 100; i++) {
                Duration delay = policy.nextDelay(attempt, random);
                assertFalse(delay.isNegative(), "negative delay on attempt " + attempt);
                assertTrue(delay.compareTo(Duration.ofSeconds(2)) <= 0, "delay above cap on attempt " + attempt);
            }
        }
    }

    @Test
    void jitterOnlyShortensTheDelay() {
        ExponentialBackoffPolicy policy = new ExponentialBackoffPolicy(Duration.ofMillis(100), 2.0, Duration.ofSeconds(10), 0.2);
        Random random = new Random() {
            private final double[] draws = {0.0, 0.5, 0.999};
            private int next;

            @Override
            public double nextDouble() {
                return draws[next++];
            }
        };

        assertEquals(Duration.ofMillis(400), policy.nextDelay(3, random));
        assertEquals(Duration.ofMillis(360), policy.nextDelay(3, random));
        Duration shortest = policy.nextDelay(3, random);
        assertTrue(shortest.compareTo(Duration.ofMillis(320)) >= 0 && shortest.compareTo(Duration.ofMillis(400)) < 0);
    }

    @Test
    void capBeyondNanosecondRangeSaturates() {
        Duration cap = Duration.ofMillis(9_999_999_999_999L);
        ExponentialBackoffPolicy policy = new ExponentialBackoffPolicy(Duration.ofMillis(100), 2.0, cap, 0.0);
        Random random = new Random(3);

        assertEquals(Duration.ofMillis(100), policy.nextDelay(1, random));
        Duration longest = policy.nextDelay(200, random);
        assertEquals(Duration.ofNanos(Long.MAX_VALUE), longest);
        assertTrue(longest.compareTo(cap) <= 0);
    }

    @Test
    void sameSeedGivesSameSequence() {
        ExponentialBackoffPolicy policy = new ExponentialBackoffPolicy();
        Random first = new Random(7);
        Random second = new Random(7);

        for (int attempt = 1; attempt <= 10; attempt++) {
            assertEquals(policy.nextDelay(attempt, first), policy.nextDelay(attempt, second));
        }
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class,
                () -> new ExponentialBackoffPolicy(Duration.ZERO, 2.0, Duration.ofSeconds(1), 0.0));
        assertThrows(IllegalArgumentException.class,
                () -> new ExponentialBackoffPolicy(Duration.ofMillis(10), 0.5, Duration.ofSeconds(1), 0.0));
        assertThrows(IllegalArgumentException.class,
                () -> new ExponentialBackoffPolicy(Duration.ofSeconds(2), 2.0, Duration.ofSeconds(1), 0.0));
        assertThrows(IllegalArgumentException.class,
                () -> new ExponentialBackoffPolicy(Duration.ofMillis(10), 2.0, Duration.ofSeconds(1), 1.5));
        assertThrows(IllegalArgumentException.class,
                () -> new ExponentialBackoffPolicy().nextDelay(0, new Random()));
    }

    @Test
    void fixedPolicyIgnoresAttempt() {
        BackoffPolicy fixed = BackoffPolicy.fixed(Duration.ofMillis(250));
        assertEquals(Duration.ofMillis(250), fixed.nextDelay(1, new Random()));
        assertEquals(Duration.ofMillis(250), fixed.nextDelay(9, new Random()));
        assertThrows(IllegalArgumentException.class, () -> BackoffPolicy.fixed(Duration.ofMillis(-1)));
    }
}

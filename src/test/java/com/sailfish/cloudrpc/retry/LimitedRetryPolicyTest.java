package com.sailfish.cloudrpc.retry;

import com.sailfish.cloudrpc.model.StatusCode;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

public class LimitedRetryPolicyTest {

    private final LimitedRetryPolicy policy = new LimitedRetryPolicy(3, Duration.ofSeconds(5));

    @Test
    void retriesTransientCodesUntilMaxAttempts() {
        assertEquals(RetryVerdict.RETRY, policy.decide(StatusCode.UNAVAILABLE, 1, Duration.ZERO));
        assertEquals(RetryVerdict.RETRY, policy.decide(StatusCode.UNAVAILABLE, 2, Duration.ofSeconds(1)));
        assertEquals(RetryVerdict.STOP_EXHAUSTED, policy.decide(StatusCode.UNAVAILABLE, 3, Duration.ofSeconds(1)));
    }

    @Test
    void stopsOnceElapsedCeilingIsReached() {
        assertEquals(RetryVerdict.RETRY, policy.decide(StatusCode.DEADLINE_EXCEEDED, 1, Duration.ofMillis(4999)));
        assertEquals(RetryVerdict.STOP_EXHAUSTED, policy.decide(StatusCode.DEADLINE_EXCEEDED, 1, Duration.ofSeconds(5)));
    }

    @Test
    void classifiesDefaultTransientCodes() {
        for (StatusCode code : StatusCode.values()) {
            if (code == StatusCode.OK) continue;
            boolean expected = LimitedRetryPolicy.DEFAULT_TRANSIENT_CODES.contains(code);
            assertEquals(expected, policy.isTransient(code), code.name());
            assertEquals(expected ? RetryVerdict.RETRY : RetryVerdict.STOP_PERMANENT,
                    policy.decide(code, 1, Duration.ZERO), code.name());
        }
        assertFalse(policy.isTransient(StatusCode.NOT_FOUND));
        assertFalse(policy.isTransient(StatusCode.ABORTED));
        assertTrue(policy.isTransient(StatusCode.RESOURCE_EXHAUSTED));
    }

    @Test
    void permanentCodeWinsOverExhaustion() {
        assertEquals(RetryVerdict.STOP_PERMANENT, policy.decide(StatusCode.INVALID_ARGUMENT, 10, Duration.ofMinutes(1)));
    }

    @Test
    void customTransientCodes() {
        LimitedRetryPolicy custom = new LimitedRetryPolicy(2, Duration.ofSeconds(1), EnumSet.of(StatusCode.ABORTED));

        assertEquals(RetryVerdict.RETRY, custom.decide(StatusCode.ABORTED, 1, Duration.ZERO));
        assertEquals(RetryVerdict.STOP_PERMANENT, custom.decide(StatusCode.UNAVAILABLE, 1, Duration.ZERO));
        assertThrows(UnsupportedOperationException.class, () -> custom.getTransientCodes().add(StatusCode.INTERNAL));
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> new LimitedRetryPolicy(0, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () -> new LimitedRetryPolicy(1, Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> new LimitedRetryPolicy(1, Duration.ofSeconds(1), EnumSet.of(StatusCode.OK)));
    }

    @Test
    void rejectsOkAndInvalidAttempts() {
        assertThrows(IllegalArgumentException.class, () -> policy.decide(StatusCode.OK, 1, Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> policy.decide(StatusCode.UNAVAILABLE, 0, Duration.ZERO));
    }

    @Test
    void noRetryPolicyStopsImmediately() {
        RetryPolicy noRetry = RetryPolicy.noRetry();
        assertNotEquals(RetryVerdict.RETRY, noRetry.decide(StatusCode.UNAVAILABLE, 1, Duration.ZERO));
    }
}

package com.sailfish.cloudrpc.storage;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class Rfc3339Test {

    private static String reformat(String timestamp) {
        return Rfc3339.format(Rfc3339.parse(timestamp));
    }

    @Test
    void noFractionalSeconds() {
        assertEquals("2018-08-02T01:02:03Z", reformat("2018-08-02T01:02:03Z"));
    }

    @Test
    void fractionalMillis() {
        assertEquals("2018-08-02T01:02:03.123Z", reformat("2018-08-02T01:02:03.123Z"));
        assertEquals("2018-08-02T01:02:03.001Z", reformat("2018-08-02T01:02:03.001Z"));
    }

    @Test
    void fractionalMicrosAndNanos() {
        assertEquals("2018-08-02T01:02:03.123456Z", reformat("2018-08-02T01:02:03.123456Z"));
        assertEquals("2018-08-02T01:02:03.123456789Z", reformat("2018-08-02T01:02:03.123456789Z"));
    }

    @Test
    void offsetsAreNormalizedToUtc() {
        assertEquals(Instant.parse("2018-08-02T08:02:03Z"), Rfc3339.parse("2018-08-02T01:02:03-07:00"));
        assertEquals("2018-08-02T08:02:03Z", reformat("2018-08-02t01:02:03-07:00"));
        assertEquals("2018-08-02T01:02:03.500Z", reformat("2018-08-02T01:02:03.5z"));
    }

    @Test
    void rejectsMalformedTimestamps() {
        assertThrows(IllegalArgumentException.class, () -> Rfc3339.parse("2018-08-02 01:02:03"));
        assertThrows(IllegalArgumentException.class, () -> Rfc3339.parse("2018-13-02T01:02:03Z"));
        assertThrows(IllegalArgumentException.class, () -> Rfc3339.parse("2018-08-02T01:02:03"));
    }
}

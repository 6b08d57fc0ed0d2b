package com.sailfish.cloudrpc.retry;

import com.sailfish.cloudrpc.model.StatusCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Retry and backoff configuration, read from properties with the {@code cloudrpc.retry.} prefix.
 *
 * <pre>
 * cloudrpc.retry.max-attempts=5
 * cloudrpc.retry.max-elapsed-ms=60000
 * cloudrpc.retry.initial-backoff-ms=100
 * cloudrpc.retry.backoff-multiplier=2.0
 * cloudrpc.retry.max-backoff-ms=10000
 * cloudrpc.retry.jitter=0.2
 * cloudrpc.retry.transient-codes=UNAVAILABLE,DEADLINE_EXCEEDED,RESOURCE_EXHAUSTED,INTERNAL
 * </pre>
 */
public final class RetrySettings {

    private static final Logger log = LoggerFactory.getLogger(RetrySettings.class);

    public static final String RESOURCE_NAME = "cloudrpc.properties";
    public static final String PREFIX = "cloudrpc.retry.";

    private final int maxAttempts;
    private final Duration maxElapsed;
    private final Duration initialBackoff;
    private final double backoffMultiplier;
    private final Duration maxBackoff;
    private final double jitter;
    private final Set<StatusCode> transientCodes;

    public RetrySettings() {
        this(LimitedRetryPolicy.DEFAULT_MAX_ATTEMPTS,
                LimitedRetryPolicy.DEFAULT_MAX_ELAPSED,
                ExponentialBackoffPolicy.DEFAULT_INITIAL_DELAY,
                ExponentialBackoffPolicy.DEFAULT_MULTIPLIER,
                ExponentialBackoffPolicy.DEFAULT_MAX_DELAY,
                ExponentialBackoffPolicy.DEFAULT_JITTER,
                LimitedRetryPolicy.DEFAULT_TRANSIENT_CODES);
    }

    public RetrySettings(int maxAttempts, Duration maxElapsed, Duration initialBackoff, double backoffMultiplier,
                         Duration maxBackoff, double jitter, Set<StatusCode> transientCodes) {
        this.maxAttempts = maxAttempts;
        this.maxElapsed = maxElapsed;
        this.initialBackoff = initialBackoff;
        this.backoffMultiplier = backoffMultiplier;
        this.maxBackoff = maxBackoff;
        this.jitter = jitter;
        this.transientCodes = Objects.requireNonNull(transientCodes, "transientCodes cannot be null");
        // Building both policies runs their validation
        toRetryPolicy();
        toBackoffPolicy();
    }

    /**
     * Reads settings from the classpath resource {@value #RESOURCE_NAME}, or returns the defaults if it is absent.
     */
    public static RetrySettings load() {
        Properties properties = new Properties();
        ClassLoader classLoader = RetrySettings.class.getClassLoader();
        try (InputStream in = classLoader.getResourceAsStream(RESOURCE_NAME)) {
            if (in == null) {
                log.debug("No {} found on the classpath, using default retry settings.", RESOURCE_NAME);
                return new RetrySettings();
            }
            properties.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE_NAME, e);
        }
        RetrySettings settings = fromProperties(properties);
        log.info("Loaded retry settings from {}: {}", RESOURCE_NAME, settings);
        return settings;
    }

    /**
     * Reads settings from the given properties. Missing keys fall back to defaults.
     *
     * @throws IllegalArgumentException if a value cannot be parsed or is out of range.
     */
    public static RetrySettings fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties cannot be null");
        RetrySettings defaults = new RetrySettings();
        return new RetrySettings(
                intValue(properties, "max-attempts", defaults.maxAttempts),
                millisValue(properties, "max-elapsed-ms", defaults.maxElapsed),
                millisValue(properties, "initial-backoff-ms", defaults.initialBackoff),
                doubleValue(properties, "backoff-multiplier", defaults.backoffMultiplier),
                millisValue(properties, "max-backoff-ms", defaults.maxBackoff),
                doubleValue(properties, "jitter", defaults.jitter),
                codesValue(properties, "transient-codes", defaults.transientCodes));
    }

    public RetryPolicy toRetryPolicy() {
        return new LimitedRetryPolicy(maxAttempts, maxElapsed, transientCodes);
    }

    public BackoffPolicy toBackoffPolicy() {
        return new ExponentialBackoffPolicy(initialBackoff, backoffMultiplier, maxBackoff, jitter);
    }

    public RetryProfile toProfile() {
        return new RetryProfile(toRetryPolicy(), toBackoffPolicy());
    }

    private static String raw(Properties properties, String key) {
        String value = properties.getProperty(PREFIX + key);
        return value == null || value.trim().isEmpty() ? null : value.trim();
    }

    private static int intValue(Properties properties, String key, int fallback) {
        String value = raw(properties, key);
        if (value == null) return fallback;
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + PREFIX + key + ": " + value, e);
        }
    }

    private static double doubleValue(Properties properties, String key, double fallback) {
        String value = raw(properties, key);
        if (value == null) return fallback;
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + PREFIX + key + ": " + value, e);
        }
    }

    private static Duration millisValue(Properties properties, String key, Duration fallback) {
        String value = raw(properties, key);
        if (value == null) return fallback;
        try {
            return Duration.ofMillis(Long.parseLong(value));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid milliseconds for " + PREFIX + key + ": " + value, e);
        }
    }

    private static Set<StatusCode> codesValue(Properties properties, String key, Set<StatusCode> fallback) {
        String value = raw(properties, key);
        if (value == null) return fallback;
        Set<StatusCode> codes = EnumSet.noneOf(StatusCode.class);
        for (String name : value.split(",")) {
            String trimmed = name.trim();
            if (trimmed.isEmpty()) continue;
            try {
                codes.add(StatusCode.valueOf(trimmed.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown status code in " + PREFIX + key + ": " + trimmed, e);
            }
        }
        return codes;
    }

    // --- Getters for configuration ---
    public int getMaxAttempts() { return maxAttempts; }
    public Duration getMaxElapsed() { return maxElapsed; }
    public Duration getInitialBackoff() { return initialBackoff; }
    public double getBackoffMultiplier() { return backoffMultiplier; }
    public Duration getMaxBackoff() { return maxBackoff; }
    public double getJitter() { return jitter; }
    public Set<StatusCode> getTransientCodes() { return transientCodes; }

    @Override
    public String toString() {
        return "RetrySettings{" +
                "maxAttempts=" + maxAttempts +
                ", maxElapsed=" + maxElapsed +
                ", initialBackoff=" + initialBackoff +
                ", backoffMultiplier=" + backoffMultiplier +
                ", maxBackoff=" + maxBackoff +
                ", jitter=" + jitter +
                ", transientCodes=" + transientCodes +
                '}';
    }
}

package com.memoryfetch.memoryfetch.memories;

import java.time.Duration;
import java.util.Map;

/**
 * Per-run retry and protocol settings for {@link MemoryDownloadExecutor}.
 *
 * @param backoffUnit   sleep after failed attempt {@code n} is {@code backoffUnit * 2^n}
 * @param directHeaders extra headers sent with every direct GET
 */
public record TransferSettings(int maxRetries, Duration backoffUnit, Map<String, String> directHeaders) {

    private static final int MAX_BACKOFF_EXPONENT = 20;

    public TransferSettings {
        if (maxRetries < 1) {
            throw new IllegalArgumentException(MemoriesConstants.MSG_INVALID_MAX_RETRIES.formatted(maxRetries));
        }
        backoffUnit = backoffUnit == null ? Duration.ZERO : backoffUnit;
        directHeaders = directHeaders == null ? Map.of() : Map.copyOf(directHeaders);
    }

    public static TransferSettings from(MemoriesProperties properties, int maxRetries) {
        return new TransferSettings(
                maxRetries,
                properties.getBackoffUnit(),
                Map.of(properties.getRouteHeaderName(), properties.getRouteHeaderValue())
        );
    }

    /**
     * Backoff after the zero-based attempt {@code failedAttempt} failed.
     */
    public Duration backoffAfter(int failedAttempt) {
        return backoffUnit.multipliedBy(1L << Math.min(failedAttempt, MAX_BACKOFF_EXPONENT));
    }
}

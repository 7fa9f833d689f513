package de.bsommerfeld.sysml.sql.api;

import de.bsommerfeld.sysml.sql.core.config.FetchConfig;

import java.time.Duration;

/**
 * Retry and timeout policy of the fetcher.
 *
 * @param maxRetries     retries of a transient failure before giving up
 * @param retryBackoff   delay before the first retry, doubled for each further one
 * @param requestTimeout limit for a single request
 * @param overallTimeout limit for the whole retrieval
 */
public record FetchOptions(int maxRetries, Duration retryBackoff, Duration requestTimeout, Duration overallTimeout) {

    public FetchOptions {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
    }

    public static FetchOptions from(FetchConfig config) {
        return new FetchOptions(config.getMaxRetries(),
                Duration.ofMillis(config.getRetryBackoffMillis()),
                Duration.ofSeconds(config.getRequestTimeoutSeconds()),
                Duration.ofMinutes(config.getOverallTimeoutMinutes()));
    }

    public static FetchOptions defaults() {
        return from(new FetchConfig());
    }

    /** Delay before retry number {@code attempt} (0-based). */
    Duration backoff(int attempt) {
        return retryBackoff.multipliedBy(1L << Math.min(attempt, 16));
    }
}

package de.bsommerfeld.sysml.sql.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Parameters for talking to a SysML v2 API server. Credentials are not part
 * of the file, they come from {@code SYSML_USERNAME} and
 * {@code SYSML_PASSWORD}.
 */
public class FetchConfig {

    @JsonProperty("page-size")
    @JsonPropertyDescription("Elements requested per page, unset leaves the choice to the server")
    private Integer pageSize;

    @JsonProperty("max-retries")
    @JsonPropertyDescription("Retries for a request that failed transiently (default: 3)")
    private int maxRetries = 3;

    @JsonProperty("retry-backoff-millis")
    @JsonPropertyDescription("Delay before the first retry, doubled on each further retry (default: 500)")
    private long retryBackoffMillis = 500;

    @JsonProperty("request-timeout-seconds")
    @JsonPropertyDescription("Timeout for a single HTTP request (default: 120)")
    private long requestTimeoutSeconds = 120;

    @JsonProperty("overall-timeout-minutes")
    @JsonPropertyDescription("Deadline for retrieving a complete model (default: 60)")
    private long overallTimeoutMinutes = 60;

    @JsonProperty("allow-invalid-certs")
    @JsonPropertyDescription("Accept invalid TLS certificates and host names (default: false)")
    private boolean allowInvalidCerts;

    public Integer getPageSize() {
        return pageSize;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public long getRetryBackoffMillis() {
        return retryBackoffMillis;
    }

    public long getRequestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }

    public long getOverallTimeoutMinutes() {
        return overallTimeoutMinutes;
    }

    public boolean isAllowInvalidCerts() {
        return allowInvalidCerts;
    }
}

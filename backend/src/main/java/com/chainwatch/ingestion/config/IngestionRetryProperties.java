package com.chainwatch.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Backoff for transient store failures (exponential ± jitter). Documented in application.yml.
 */
@ConfigurationProperties(prefix = "chainwatch.ingestion.retry")
@NoArgsConstructor
@Getter
@Setter
public class IngestionRetryProperties {

    /** Base delay in ms for first retry; doubles each attempt. Default 500. */
    private long baseDelayMs = 500L;

    /** Jitter factor 0..1 (e.g. 0.2 = ±20%). Default 0.2. */
    private double jitterFactor = 0.2;

    /** Attempts after which the delay stops growing. Default 5. */
    private int maxAttempts = 5;
}

package com.example.safespace.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Binds properties:
 *
 * safespace.retry.max-attempts=3
 * safespace.retry.base-delay=1s
 * safespace.retry.max-delay=30s
 */
@Data
@Validated
@ConfigurationProperties(prefix = "safespace.retry")
public class RetryProperties {

    /**
     * Total calls to the generation collaborator, first attempt included.
     */
    @Min(1)
    private int maxAttempts = 3;

    /**
     * Wait before the first retry; doubles for every further retry.
     */
    @NotNull
    private Duration baseDelay = Duration.ofSeconds(1);

    /**
     * Ceiling for a single wait.
     */
    @NotNull
    private Duration maxDelay = Duration.ofSeconds(30);
}

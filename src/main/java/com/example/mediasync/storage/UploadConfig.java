package com.example.mediasync.storage;

import java.time.Duration;

/**
 * Retry and patience settings of the upload coordinator.
 */
public record UploadConfig(
        int maxRetries,
        Duration minTimeout,
        boolean recordFailures
) {
    public static UploadConfig defaults() {
        return new UploadConfig(2, Duration.ofSeconds(30), true);
    }

    public int maxAttempts() {
        return 1 + Math.max(0, maxRetries);
    }
}

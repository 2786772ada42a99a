package com.example.mediasync.metadata;

import java.time.Instant;
import java.util.List;

/**
 * Operational record written when a file exhausts its upload attempts.
 */
public class FailedUpload {
    private final String fileId;
    private final String owner;
    private final String destination;
    private final int attempts;
    private final int maxAttempts;
    private final Instant lastAttemptTime;
    private final String lastError;
    private final List<RetryAttempt> retryAttempts;

    public FailedUpload(String fileId,
                        String owner,
                        String destination,
                        int attempts,
                        int maxAttempts,
                        Instant lastAttemptTime,
                        String lastError,
                        List<RetryAttempt> retryAttempts) {
        this.fileId = fileId;
        this.owner = owner;
        this.destination = destination;
        this.attempts = attempts;
        this.maxAttempts = maxAttempts;
        this.lastAttemptTime = lastAttemptTime;
        this.lastError = lastError;
        this.retryAttempts = List.copyOf(retryAttempts);
    }

    public String getFileId() {
        return fileId;
    }

    public String getOwner() {
        return owner;
    }

    public String getDestination() {
        return destination;
    }

    public int getAttempts() {
        return attempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Instant getLastAttemptTime() {
        return lastAttemptTime;
    }

    public String getLastError() {
        return lastError;
    }

    public List<RetryAttempt> getRetryAttempts() {
        return retryAttempts;
    }
}

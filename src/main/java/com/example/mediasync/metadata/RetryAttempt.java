package com.example.mediasync.metadata;

import java.time.Instant;

public class RetryAttempt {
    private final int attempt;
    private final Instant timestamp;
    private final String destination;
    private final String error;

    public RetryAttempt(int attempt, Instant timestamp, String destination, String error) {
        this.attempt = attempt;
        this.timestamp = timestamp;
        this.destination = destination;
        this.error = error;
    }

    public int getAttempt() {
        return attempt;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getDestination() {
        return destination;
    }

    public String getError() {
        return error;
    }
}

package com.example.mediasync.scan;

import java.time.Instant;

/**
 * A chat visible in the web client, with the time of its most recent message.
 */
public record ActiveChat(
        String identity,
        String label,
        Instant lastActivity
) {
}

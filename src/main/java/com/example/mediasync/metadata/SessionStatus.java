package com.example.mediasync.metadata;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of a remote web-client session. {@link #CLOSED} is the only terminal state and
 * {@link #ERROR} can be entered from anywhere else.
 */
public enum SessionStatus {
    INACTIVE,
    QR_PENDING,
    AUTHENTICATED,
    ERROR,
    CLOSED;

    public boolean canTransitionTo(SessionStatus next) {
        if (this == CLOSED) {
            return false;
        }
        if (next == ERROR || next == CLOSED) {
            return true;
        }
        if (this == AUTHENTICATED) {
            return next == AUTHENTICATED;
        }
        return next == QR_PENDING || next == AUTHENTICATED;
    }

    public boolean isLive() {
        return this == QR_PENDING || this == AUTHENTICATED;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SessionStatus fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

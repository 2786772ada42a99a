package com.example.mediasync;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Machine-readable classification attached to every failure surfaced to callers.
 */
public enum ErrorKind {
    CAPABILITY_UNAVAILABLE,
    NOT_AUTHENTICATED,
    PROBE_TIMEOUT,
    LOCAL_FILE_MISSING,
    DUPLICATE_CONTENT,
    REMOTE_COLLISION,
    UPLOAD_VERIFICATION_FAILED,
    RETRIES_EXHAUSTED,
    NOT_FOUND,
    SESSION_CLOSED,
    INVALID_REQUEST,
    STORE_FAILURE;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}

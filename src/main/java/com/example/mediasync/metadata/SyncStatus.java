package com.example.mediasync.metadata;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Upload state of a file record. A synced record only leaves {@link #SYNCED} through the
 * explicit storage remediation pass, and never goes back to {@link #NOT_SYNCED}.
 */
public enum SyncStatus {
    NOT_SYNCED,
    SYNCED,
    SYNC_ERROR;

    public boolean canTransitionTo(SyncStatus next) {
        return this == NOT_SYNCED || next != NOT_SYNCED;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SyncStatus fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

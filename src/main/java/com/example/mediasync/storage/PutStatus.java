package com.example.mediasync.storage;

/**
 * Result of a conditional put. An occupied key is reported as {@link #EXISTS} rather than thrown.
 */
public enum PutStatus {
    CREATED,
    EXISTS
}

package com.example.mediasync.storage;

public record SyncStats(
        int total,
        int successful,
        int skippedDuplicates,
        int errors,
        int timeouts
) {
    public static SyncStats empty() {
        return new SyncStats(0, 0, 0, 0, 0);
    }
}

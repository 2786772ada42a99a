package com.example.mediasync.scan;

import com.example.mediasync.metadata.MediaCategory;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

public record ScanStats(
        long filesAccepted,
        long totalBytes,
        Map<MediaCategory, Long> categories,
        long errorCount,
        long duplicateCount,
        long alreadyKnown,
        Map<String, IdentityStats> identities,
        int rootsScanned,
        boolean degraded
) {
    /**
     * Creates an immutable snapshot of the running scan totals.
     */
    public static ScanStats from(ScanTally tally) {
        Map<String, IdentityStats> identities = new LinkedHashMap<>();
        tally.identities().forEach((identity, stats) -> identities.put(identity, stats.snapshot()));
        return new ScanStats(
                tally.filesAccepted(),
                tally.totalBytes(),
                new EnumMap<>(tally.categories()),
                tally.errorCount(),
                tally.duplicateCount(),
                tally.alreadyKnown(),
                identities,
                tally.rootsScanned(),
                tally.rootsScanned() == 0
        );
    }
}

package com.example.mediasync;

import com.example.mediasync.scan.ScanStats;

/**
 * Outcome of a scan followed by ingestion into the metadata store.
 */
public record ScanReport(
        int discovered,
        int inserted,
        ScanStats stats
) {
}

package com.example.mediasync.scan;

import com.example.mediasync.metadata.FileRecord;

import java.util.List;

/**
 * New, not yet persisted records found by a scan together with the pass statistics.
 */
public record ScanResult(
        List<FileRecord> records,
        ScanStats stats
) {
}

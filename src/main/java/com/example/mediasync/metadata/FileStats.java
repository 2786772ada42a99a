package com.example.mediasync.metadata;

import java.util.Map;

/**
 * Aggregate view of an owner's files, grouped by upload state, category and sender.
 */
public record FileStats(
        long totalFiles,
        long syncedFiles,
        long errorFiles,
        long pendingFiles,
        long totalSizeBytes,
        double percentSynced,
        Map<MediaCategory, Long> mediaCategories,
        Map<String, Long> senders
) {
    public static FileStats of(long total,
                               long synced,
                               long errors,
                               long totalSize,
                               Map<MediaCategory, Long> categories,
                               Map<String, Long> senders) {
        double percent = total == 0 ? 0.0 : Math.round(synced * 10000.0 / total) / 100.0;
        return new FileStats(total, synced, errors, total - synced - errors, totalSize, percent,
                Map.copyOf(categories), Map.copyOf(senders));
    }
}

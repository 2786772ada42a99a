package com.example.mediasync.scan;

import com.example.mediasync.metadata.MediaCategory;

import java.nio.file.Path;
import java.time.Instant;

public record InspectedFile(
        Path path,
        String filename,
        long size,
        Instant effectiveTimestamp,
        String contentType,
        MediaCategory category,
        String contentHash
) {
}

package com.example.mediasync;

import com.example.mediasync.session.SessionConfig;
import com.example.mediasync.storage.StorageConfig;
import com.example.mediasync.storage.UploadConfig;

import java.nio.file.Path;
import java.util.List;

/**
 * Immutable runtime settings for the media sync pipeline.
 */
public record MediaSyncConfig(
        Path dataDirectory,
        List<Path> roots,
        String jdbcUrl,
        StorageConfig storage,
        SessionConfig session,
        UploadConfig upload,
        int insertBatchSize
) {
}

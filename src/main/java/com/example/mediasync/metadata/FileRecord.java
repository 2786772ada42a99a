package com.example.mediasync.metadata;

import java.time.Instant;

/**
 * Persisted description of one discovered media file and its upload outcome.
 */
public record FileRecord(
        String id,
        String owner,
        String filename,
        String localPath,
        String organizedPath,
        String contentHash,
        long size,
        String contentType,
        MediaCategory mediaCategory,
        String senderIdentity,
        SyncStatus syncStatus,
        int retryCount,
        String lastError,
        String remotePath,
        String remoteUrl,
        Instant createdAt,
        Instant updatedAt
) {
    public static final String UNKNOWN_SENDER = "unknown";

    /**
     * Creates a not-yet-persisted record for a file found on disk.
     */
    public static FileRecord discovered(String owner,
                                        String filename,
                                        String localPath,
                                        String organizedPath,
                                        String contentHash,
                                        long size,
                                        String contentType,
                                        MediaCategory mediaCategory,
                                        String senderIdentity) {
        return new FileRecord(
                null,
                owner,
                filename,
                localPath,
                organizedPath,
                contentHash,
                size,
                contentType,
                mediaCategory,
                senderIdentity == null ? UNKNOWN_SENDER : senderIdentity,
                SyncStatus.NOT_SYNCED,
                0,
                null,
                null,
                null,
                null,
                null
        );
    }

    public FileRecord persisted(String newId, Instant now) {
        return new FileRecord(newId, owner, filename, localPath, organizedPath, contentHash, size, contentType,
                mediaCategory, senderIdentity, syncStatus, retryCount, lastError, remotePath, remoteUrl, now, now);
    }

    public boolean isSynced() {
        return syncStatus == SyncStatus.SYNCED;
    }

    public boolean hasKnownSender() {
        return senderIdentity != null && !senderIdentity.isBlank() && !UNKNOWN_SENDER.equals(senderIdentity);
    }
}

package com.example.mediasync.metadata;

import java.time.Instant;

/**
 * Partial update of a {@link FileRecord}. Null fields are left untouched.
 */
public record FileUpdate(
        SyncStatus syncStatus,
        Integer retryCount,
        String lastError,
        boolean clearError,
        String remotePath,
        String remoteUrl,
        String senderIdentity,
        String organizedPath
) {
    public static FileUpdate synced(String remotePath, String remoteUrl) {
        return new FileUpdate(SyncStatus.SYNCED, null, null, true, remotePath, remoteUrl, null, null);
    }

    public static FileUpdate failed(String message) {
        return new FileUpdate(SyncStatus.SYNC_ERROR, null, message, false, null, null, null, null);
    }

    public static FileUpdate retryCount(int retryCount) {
        return new FileUpdate(null, retryCount, null, false, null, null, null, null);
    }

    public static FileUpdate sender(String senderIdentity, String organizedPath) {
        return new FileUpdate(null, null, null, false, null, null, senderIdentity, organizedPath);
    }

    /**
     * Returns a copy of {@code current} with this patch applied.
     *
     * @throws IllegalStateException if the status change is not a legal forward transition
     */
    public FileRecord applyTo(FileRecord current, Instant now) {
        SyncStatus status = current.syncStatus();
        if (syncStatus != null) {
            if (!status.canTransitionTo(syncStatus)) {
                throw new IllegalStateException(
                        "Illegal sync status change " + status.wireValue() + " -> " + syncStatus.wireValue()
                                + " for file " + current.id());
            }
            status = syncStatus;
        }
        String error = clearError ? null : (lastError != null ? lastError : current.lastError());
        return new FileRecord(
                current.id(),
                current.owner(),
                current.filename(),
                current.localPath(),
                organizedPath != null ? organizedPath : current.organizedPath(),
                current.contentHash(),
                current.size(),
                current.contentType(),
                current.mediaCategory(),
                senderIdentity != null ? senderIdentity : current.senderIdentity(),
                status,
                retryCount != null ? retryCount : current.retryCount(),
                error,
                remotePath != null ? remotePath : current.remotePath(),
                remoteUrl != null ? remoteUrl : current.remoteUrl(),
                current.createdAt(),
                now
        );
    }
}

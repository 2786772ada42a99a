package com.example.mediasync.metadata;

/**
 * Equality filter over file records. Every criterion except the owner is optional.
 */
public record FileQuery(
        String owner,
        SyncStatus syncStatus,
        String senderIdentity,
        MediaCategory mediaCategory,
        String contentHash
) {
    public static FileQuery forOwner(String owner) {
        return new FileQuery(owner, null, null, null, null);
    }

    public FileQuery withStatus(SyncStatus status) {
        return new FileQuery(owner, status, senderIdentity, mediaCategory, contentHash);
    }

    public FileQuery withSender(String sender) {
        return new FileQuery(owner, syncStatus, sender, mediaCategory, contentHash);
    }

    public FileQuery withCategory(MediaCategory category) {
        return new FileQuery(owner, syncStatus, senderIdentity, category, contentHash);
    }

    public FileQuery withHash(String hash) {
        return new FileQuery(owner, syncStatus, senderIdentity, mediaCategory, hash);
    }

    public boolean matches(FileRecord record) {
        return owner.equals(record.owner())
                && (syncStatus == null || syncStatus == record.syncStatus())
                && (senderIdentity == null || senderIdentity.equals(record.senderIdentity()))
                && (mediaCategory == null || mediaCategory == record.mediaCategory())
                && (contentHash == null || contentHash.equals(record.contentHash()));
    }
}

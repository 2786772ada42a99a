package com.example.mediasync.storage;

public record RemediationResult(
        StorageVerification verification,
        int requeued,
        SyncStats resync
) {
}

package com.example.mediasync;

import com.example.mediasync.storage.SyncStats;

public record ImportReport(
        int requested,
        int inserted,
        int alreadyKnown,
        int failed,
        SyncStats sync
) {
}

package com.example.mediasync;

public record DeleteReport(
        String fileId,
        boolean remoteDeleted
) {
}

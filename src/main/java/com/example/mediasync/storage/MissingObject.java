package com.example.mediasync.storage;

public record MissingObject(
        String fileId,
        String filename,
        String remotePath
) {
}

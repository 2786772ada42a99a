package com.example.mediasync.storage;

import java.time.Instant;

public record StoredObject(
        String path,
        long size,
        Instant lastModified
) {
    public String name() {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }
}

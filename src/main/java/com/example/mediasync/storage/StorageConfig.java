package com.example.mediasync.storage;

import java.util.Optional;

public record StorageConfig(
        String bucket,
        Optional<String> region,
        Optional<String> endpoint,
        boolean pathStyleAccess,
        Optional<String> publicBaseUrl
) {
}

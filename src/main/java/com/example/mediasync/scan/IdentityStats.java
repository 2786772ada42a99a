package com.example.mediasync.scan;

import java.util.Map;

public record IdentityStats(
        long count,
        long totalBytes,
        Map<String, Long> contentTypes
) {
}

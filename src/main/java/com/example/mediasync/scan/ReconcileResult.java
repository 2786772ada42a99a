package com.example.mediasync.scan;

public record ReconcileResult(
        int processed,
        int updated,
        int organized,
        int failed
) {
}

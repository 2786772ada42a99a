package com.example.mediasync.storage;

import java.util.List;

public record StorageVerification(
        int checked,
        int present,
        List<MissingObject> missing
) {
}

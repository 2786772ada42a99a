package com.example.mediasync;

public record FileUrl(
        String fileId,
        String remotePath,
        String url
) {
}

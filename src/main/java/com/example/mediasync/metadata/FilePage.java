package com.example.mediasync.metadata;

import java.util.List;

public record FilePage(
        List<FileRecord> files,
        long total,
        int limit,
        int offset,
        boolean hasMore
) {
    public static FilePage of(List<FileRecord> files, long total, int limit, int offset) {
        return new FilePage(List.copyOf(files), total, limit, offset, (long) offset + limit < total);
    }
}

package com.example.mediasync.storage;

import com.example.mediasync.metadata.FileRecord;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Remote naming rules for uploaded files.
 */
public final class DestinationPaths {
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);

    private DestinationPaths() {
    }

    /**
     * {@code <sender>/<filename>} for attributed files, {@code <owner>/<stamp>_<filename>} otherwise.
     */
    public static String primary(FileRecord record, Instant now) {
        if (record.hasKnownSender()) {
            return record.senderIdentity().replace("+", "").replace(" ", "") + "/" + record.filename();
        }
        return record.owner() + "/" + STAMP.format(now) + "_" + record.filename();
    }

    /**
     * Inserts a timestamp before the extension: {@code dir/a.jpg} becomes {@code dir/a_<stamp>.jpg}.
     */
    public static String alternate(String path, Instant now) {
        String prefix = parentPrefix(path);
        String name = path.substring(prefix.length());
        int dot = name.lastIndexOf('.');
        String stem = dot <= 0 ? name : name.substring(0, dot);
        String extension = dot <= 0 ? "" : name.substring(dot);
        return prefix + stem + "_" + STAMP.format(now) + extension;
    }

    /**
     * Everything up to and including the last slash, or an empty string.
     */
    public static String parentPrefix(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? "" : path.substring(0, slash + 1);
    }
}

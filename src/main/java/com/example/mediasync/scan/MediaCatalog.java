package com.example.mediasync.scan;

import com.example.mediasync.metadata.MediaCategory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Extension groups and client naming patterns that decide which files are media and how they are classified.
 */
public final class MediaCatalog {
    private static final Map<MediaCategory, Set<String>> EXTENSIONS = new LinkedHashMap<>();
    private static final List<String> CLIENT_PATTERNS = List.of(
            "whatsapp image",
            "whatsapp video",
            "whatsapp audio",
            "whatsapp document",
            "wa",
            "img-",
            "vid-",
            "aud-",
            "doc-",
            "ptt-"
    );

    static {
        EXTENSIONS.put(MediaCategory.IMAGE, Set.of(
                ".jpg", ".jpeg", ".png", ".gif", ".webp", ".bmp", ".tiff", ".heic"));
        EXTENSIONS.put(MediaCategory.DOCUMENT, Set.of(
                ".pdf", ".doc", ".docx", ".xls", ".xlsx", ".ppt", ".pptx", ".txt", ".csv", ".rtf",
                ".odt", ".ods", ".odp", ".pages", ".numbers", ".key"));
        EXTENSIONS.put(MediaCategory.AUDIO, Set.of(
                ".mp3", ".wav", ".ogg", ".m4a", ".aac", ".flac", ".opus", ".amr"));
        EXTENSIONS.put(MediaCategory.VIDEO, Set.of(
                ".mp4", ".mkv", ".avi", ".mov", ".wmv", ".flv", ".webm", ".m4v", ".3gp"));
        EXTENSIONS.put(MediaCategory.ARCHIVE, Set.of(
                ".zip", ".rar", ".7z", ".tar", ".gz", ".bz2"));
    }

    private MediaCatalog() {
    }

    public static MediaCategory categoryOf(String filename) {
        String extension = extensionOf(filename);
        for (Map.Entry<MediaCategory, Set<String>> entry : EXTENSIONS.entrySet()) {
            if (entry.getValue().contains(extension)) {
                return entry.getKey();
            }
        }
        return MediaCategory.OTHER;
    }

    /**
     * A file is a candidate when its extension belongs to a group or its name carries a client pattern.
     */
    public static boolean isCandidate(String filename) {
        if (categoryOf(filename) != MediaCategory.OTHER) {
            return true;
        }
        String lower = filename.toLowerCase(Locale.ROOT);
        for (String pattern : CLIENT_PATTERNS) {
            if (lower.contains(pattern)) {
                return true;
            }
        }
        return false;
    }

    public static boolean isHidden(String filename) {
        return filename.startsWith(".");
    }

    /**
     * Returns the lower-cased extension including the dot, or an empty string.
     */
    public static String extensionOf(String filename) {
        int dot = filename.lastIndexOf('.');
        if (dot <= 0 || dot == filename.length() - 1) {
            return "";
        }
        return filename.substring(dot).toLowerCase(Locale.ROOT);
    }
}

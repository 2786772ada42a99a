package com.example.mediasync.scan;

import com.example.mediasync.metadata.FileRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves the sender identity of a media file from its path, its name and the timing of active chats.
 * Resolution is deterministic for identical inputs.
 */
public final class PhoneAttributor {
    public static final Duration DEFAULT_PROXIMITY_WINDOW = Duration.ofHours(12);

    private static final List<Pattern> FOLDER_PATTERNS = List.of(
            Pattern.compile("(\\d+)@s\\.whatsapp\\.net"),
            Pattern.compile("(\\d+)@status")
    );
    private static final List<Pattern> FILENAME_PATTERNS = List.of(
            Pattern.compile("from \\+(\\d+)"),
            Pattern.compile("from \\((\\d+)\\)"),
            Pattern.compile("from (\\d{10,})"),
            Pattern.compile("(\\d{10,})\\."),
            Pattern.compile("WhatsApp.*?(\\d{10,})")
    );

    private final Duration proximityWindow;

    public PhoneAttributor() {
        this(DEFAULT_PROXIMITY_WINDOW);
    }

    public PhoneAttributor(Duration proximityWindow) {
        this.proximityWindow = proximityWindow;
    }

    /**
     * Returns the sender identity for the file, or {@link FileRecord#UNKNOWN_SENDER}.
     *
     * @param pathOrName    full path or bare file name; null or blank yields the unknown sender
     * @param fileTimestamp effective timestamp of the file, may be null
     * @param activeChats   chats read from the live session, may be empty
     */
    public String attribute(String pathOrName, Instant fileTimestamp, List<ActiveChat> activeChats) {
        if (pathOrName == null || pathOrName.isBlank()) {
            return FileRecord.UNKNOWN_SENDER;
        }
        Optional<String> fromFolder = folderIdentity(pathOrName);
        if (fromFolder.isPresent()) {
            return fromFolder.get();
        }
        String name = fileName(pathOrName);
        for (Pattern pattern : FILENAME_PATTERNS) {
            Matcher matcher = pattern.matcher(name);
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        return closestChat(fileTimestamp, activeChats).orElse(FileRecord.UNKNOWN_SENDER);
    }

    /**
     * Applies only the folder markers. Used when re-attributing records whose sender is still unknown.
     */
    public Optional<String> folderIdentity(String path) {
        if (path == null) {
            return Optional.empty();
        }
        for (Pattern pattern : FOLDER_PATTERNS) {
            Matcher matcher = pattern.matcher(path);
            if (matcher.find()) {
                return Optional.of(matcher.group(1));
            }
        }
        return Optional.empty();
    }

    private Optional<String> closestChat(Instant fileTimestamp, List<ActiveChat> activeChats) {
        if (fileTimestamp == null || activeChats == null || activeChats.isEmpty()) {
            return Optional.empty();
        }
        ActiveChat best = null;
        long bestDiff = Long.MAX_VALUE;
        for (ActiveChat chat : activeChats) {
            if (chat.lastActivity() == null || chat.identity() == null) {
                continue;
            }
            long diff = Math.abs(Duration.between(chat.lastActivity(), fileTimestamp).toMillis());
            if (diff < bestDiff || (diff == bestDiff && chat.identity().compareTo(best.identity()) < 0)) {
                best = chat;
                bestDiff = diff;
            }
        }
        if (best == null || bestDiff >= proximityWindow.toMillis()) {
            return Optional.empty();
        }
        return Optional.of(best.identity());
    }

    private static String fileName(String pathOrName) {
        int slash = Math.max(pathOrName.lastIndexOf('/'), pathOrName.lastIndexOf('\\'));
        return slash < 0 ? pathOrName : pathOrName.substring(slash + 1);
    }
}

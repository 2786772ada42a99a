package com.example.mediasync.scan;

import com.example.mediasync.metadata.MediaCategory;

import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Running totals of one scan pass.
 */
public final class ScanTally {
    private long filesAccepted;
    private long totalBytes;
    private long errorCount;
    private long duplicateCount;
    private long alreadyKnown;
    private int rootsScanned;
    private final Map<MediaCategory, Long> categories = new EnumMap<>(MediaCategory.class);
    private final Map<String, IdentityTally> identities = new TreeMap<>();

    public void addFile(InspectedFile file, String identity) {
        filesAccepted++;
        totalBytes += file.size();
        categories.merge(file.category(), 1L, Long::sum);
        identities.computeIfAbsent(identity, ignored -> new IdentityTally()).add(file);
    }

    public void addError() {
        errorCount++;
    }

    public void addDuplicate() {
        duplicateCount++;
    }

    public void addAlreadyKnown() {
        alreadyKnown++;
    }

    public void addRoot() {
        rootsScanned++;
    }

    public long filesAccepted() {
        return filesAccepted;
    }

    public long totalBytes() {
        return totalBytes;
    }

    public long errorCount() {
        return errorCount;
    }

    public long duplicateCount() {
        return duplicateCount;
    }

    public long alreadyKnown() {
        return alreadyKnown;
    }

    public int rootsScanned() {
        return rootsScanned;
    }

    Map<MediaCategory, Long> categories() {
        return categories;
    }

    Map<String, IdentityTally> identities() {
        return identities;
    }

    static final class IdentityTally {
        private long count;
        private long bytes;
        private final Map<String, Long> types = new TreeMap<>();

        void add(InspectedFile file) {
            count++;
            bytes += file.size();
            types.merge(file.contentType(), 1L, Long::sum);
        }

        IdentityStats snapshot() {
            return new IdentityStats(count, bytes, Map.copyOf(types));
        }
    }
}

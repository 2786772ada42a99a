package com.example.mediasync.scan;

import com.example.mediasync.metadata.FileRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Walks media roots breadth-first and turns accepted files into attributed, deduplicated records.
 */
public final class MediaScanner {
    private static final Logger LOGGER = LoggerFactory.getLogger(MediaScanner.class);
    private static final int PROGRESS_INTERVAL = 100;

    private final MediaFileInspector inspector;
    private final PhoneAttributor attributor;
    private final FileOrganizer organizer;

    public MediaScanner(MediaFileInspector inspector, PhoneAttributor attributor, FileOrganizer organizer) {
        this.inspector = inspector;
        this.attributor = attributor;
        this.organizer = organizer;
    }

    /**
     * Scans the given roots. Files whose hash is already known for the owner are counted but not returned.
     */
    public ScanResult scan(String owner, List<Path> roots, List<ActiveChat> activeChats, Set<String> knownHashes) {
        ScanTally tally = new ScanTally();
        List<FileRecord> records = new ArrayList<>();
        Set<String> seenNameAndSize = new HashSet<>();
        Set<String> seenHashes = new HashSet<>(knownHashes);

        for (Path root : roots) {
            if (!Files.isDirectory(root, LinkOption.NOFOLLOW_LINKS) || !Files.isReadable(root)) {
                LOGGER.info("Skipping missing or unreadable root {}", root);
                continue;
            }
            tally.addRoot();
            LOGGER.info("Scanning {}", root);
            try {
                walk(owner, root, activeChats, tally, records, seenNameAndSize, seenHashes);
            } catch (RuntimeException ex) {
                LOGGER.warn("Scan of root {} aborted", root, ex);
            }
        }

        ScanStats stats = ScanStats.from(tally);
        LOGGER.info("Scan finished: {} accepted, {} new, {} already known, {} duplicates, {} errors across {} roots",
                stats.filesAccepted(), records.size(), stats.alreadyKnown(), stats.duplicateCount(),
                stats.errorCount(), stats.rootsScanned());
        return new ScanResult(records, stats);
    }

    private void walk(String owner,
                      Path root,
                      List<ActiveChat> activeChats,
                      ScanTally tally,
                      List<FileRecord> records,
                      Set<String> seenNameAndSize,
                      Set<String> seenHashes) {
        Deque<Path> pending = new ArrayDeque<>();
        pending.addLast(root);
        while (!pending.isEmpty()) {
            Path current = pending.removeFirst();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(current)) {
                for (Path entry : stream) {
                    String name = entry.getFileName().toString();
                    if (MediaCatalog.isHidden(name) || Files.isSymbolicLink(entry)) {
                        continue;
                    }
                    if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                        pending.addLast(entry);
                    } else if (Files.isRegularFile(entry, LinkOption.NOFOLLOW_LINKS) && MediaCatalog.isCandidate(name)) {
                        processFile(owner, entry, activeChats, tally, records, seenNameAndSize, seenHashes);
                    }
                }
            } catch (IOException ex) {
                LOGGER.warn("Failed to list directory {}", current, ex);
                tally.addError();
            }
        }
    }

    private void processFile(String owner,
                             Path file,
                             List<ActiveChat> activeChats,
                             ScanTally tally,
                             List<FileRecord> records,
                             Set<String> seenNameAndSize,
                             Set<String> seenHashes) {
        InspectedFile inspected;
        try {
            inspected = inspector.inspect(file);
        } catch (IOException | SecurityException ex) {
            LOGGER.warn("Failed to inspect {}", file, ex);
            tally.addError();
            return;
        }
        if (!seenNameAndSize.add(inspected.filename() + "|" + inspected.size())) {
            tally.addDuplicate();
            return;
        }
        String identity = attributor.attribute(file.toString(), inspected.effectiveTimestamp(), activeChats);
        tally.addFile(inspected, identity);
        if (tally.filesAccepted() % PROGRESS_INTERVAL == 0) {
            LOGGER.info("Scanned {} media files so far", tally.filesAccepted());
        }
        if (!seenHashes.add(inspected.contentHash())) {
            tally.addAlreadyKnown();
            return;
        }
        records.add(toRecord(owner, inspected, identity, organize(inspected, identity)));
    }

    /**
     * Builds a record for a file the caller names explicitly, bypassing the directory walk.
     */
    public FileRecord recordFor(String owner, Path file, String identityOverride, List<ActiveChat> activeChats)
            throws IOException {
        InspectedFile inspected = inspector.inspect(file);
        String identity = identityOverride != null && !identityOverride.isBlank()
                ? identityOverride
                : attributor.attribute(file.toString(), inspected.effectiveTimestamp(), activeChats);
        return toRecord(owner, inspected, identity, organize(inspected, identity));
    }

    private String organize(InspectedFile inspected, String identity) {
        try {
            Optional<Path> organized = organizer.organize(inspected.path(), inspected.contentHash(), identity,
                    inspected.category());
            return organized.map(Path::toString).orElse(null);
        } catch (IOException ex) {
            LOGGER.warn("Failed to organize {}", inspected.path(), ex);
            return null;
        }
    }

    private static FileRecord toRecord(String owner, InspectedFile inspected, String identity, String organizedPath) {
        return FileRecord.discovered(
                owner,
                inspected.filename(),
                inspected.path().toAbsolutePath().toString(),
                organizedPath,
                inspected.contentHash(),
                inspected.size(),
                inspected.contentType(),
                inspected.category(),
                identity
        );
    }
}

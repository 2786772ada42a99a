package com.example.mediasync.storage;

import com.example.mediasync.metadata.FailedUpload;
import com.example.mediasync.metadata.FileQuery;
import com.example.mediasync.metadata.FileRecord;
import com.example.mediasync.metadata.FileUpdate;
import com.example.mediasync.metadata.MetadataStore;
import com.example.mediasync.metadata.RetryAttempt;
import com.example.mediasync.metadata.SyncStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Uploads unsynced records to the object store. Each record goes through existence and dedup checks,
 * a conditional put, a verification probe and bounded retries with a collision rename.
 * Records are processed sequentially.
 */
public final class UploadCoordinator {
    private static final Logger LOGGER = LoggerFactory.getLogger(UploadCoordinator.class);
    private static final int PROGRESS_INTERVAL = 10;
    private static final int MAX_ERROR_LENGTH = 255;
    private static final long TIMEOUT_CHUNK_BYTES = 10L * 1024 * 1024;
    private static final Duration TIMEOUT_PER_CHUNK = Duration.ofSeconds(30);
    private static final int VERIFY_PAGE_SIZE = 500;

    static final String MISSING_REMOTE = "Remote object missing";

    private final MetadataStore store;
    private final ObjectStore objectStore;
    private final UploadConfig config;
    private final Clock clock;

    public UploadCoordinator(MetadataStore store, ObjectStore objectStore, UploadConfig config, Clock clock) {
        this.store = store;
        this.objectStore = objectStore;
        this.config = config;
        this.clock = clock;
    }

    public SyncStats sync(List<FileRecord> records) {
        int successful = 0;
        int skipped = 0;
        int errors = 0;
        int timeouts = 0;
        int processed = 0;
        for (FileRecord record : records) {
            if (record.isSynced()) {
                continue;
            }
            Outcome outcome;
            try {
                outcome = syncRecord(record);
            } catch (RuntimeException ex) {
                LOGGER.warn("Unexpected failure syncing {}", record.id(), ex);
                markFailed(record, ex.getMessage());
                outcome = Outcome.ERROR;
            }
            if (outcome == Outcome.UPLOADED) {
                successful++;
            } else if (outcome == Outcome.SKIPPED) {
                skipped++;
            } else if (outcome == Outcome.TIMEOUT) {
                timeouts++;
            } else {
                errors++;
            }
            processed++;
            if (processed % PROGRESS_INTERVAL == 0) {
                LOGGER.info("Sync progress: {}/{} records", processed, records.size());
            }
        }
        SyncStats stats = new SyncStats(processed, successful, skipped, errors, timeouts);
        LOGGER.info("Sync finished: {} uploaded, {} skipped, {} errors, {} timeouts",
                successful, skipped, errors, timeouts);
        return stats;
    }

    private Outcome syncRecord(FileRecord record) {
        Optional<Path> source = localSource(record);
        if (source.isEmpty()) {
            String message = "Local file not found: " + record.localPath();
            LOGGER.warn("{} (record {})", message, record.id());
            store.updateFile(record.id(), FileUpdate.failed(truncate(message)));
            return Outcome.ERROR;
        }

        if (record.contentHash() != null) {
            Optional<FileRecord> twin = store.findSyncedByHash(record.owner(), record.contentHash(), record.id());
            if (twin.isPresent()) {
                LOGGER.info("Record {} shares content with {}; reusing {}", record.id(), twin.get().id(),
                        twin.get().remotePath());
                store.updateFile(record.id(), FileUpdate.synced(twin.get().remotePath(), twin.get().remoteUrl()));
                return Outcome.SKIPPED;
            }
        }

        return upload(record, source.get(), DestinationPaths.primary(record, clock.instant()));
    }

    private Outcome upload(FileRecord record, Path source, String base) {
        int maxAttempts = config.maxAttempts();
        Duration timeout = timeoutFor(record.size());
        String destination = base;
        int retryCount = record.retryCount();
        String lastError = null;
        boolean lastWasTimeout = false;
        List<RetryAttempt> history = new ArrayList<>();
        boolean existenceChecked = false;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            lastWasTimeout = false;
            try {
                if (!existenceChecked) {
                    if (exists(base)) {
                        LOGGER.info("Object {} already present; marking record {} synced", base, record.id());
                        store.updateFile(record.id(), FileUpdate.synced(base, objectStore.publicUrl(base)));
                        return Outcome.SKIPPED;
                    }
                    existenceChecked = true;
                }
                PutStatus status = objectStore.put(destination, source, record.contentType(), timeout);
                if (status == PutStatus.CREATED) {
                    if (exists(destination)) {
                        store.updateFile(record.id(),
                                FileUpdate.synced(destination, objectStore.publicUrl(destination)));
                        LOGGER.info("Synced record {} to {} on attempt {}", record.id(), destination, attempt);
                        return Outcome.UPLOADED;
                    }
                    lastError = "Upload verification failed for " + destination;
                } else {
                    lastError = "Remote object already exists at " + destination;
                }
            } catch (ObjectStoreTimeoutException ex) {
                lastError = ex.getMessage();
                lastWasTimeout = true;
            } catch (ObjectStoreException ex) {
                lastError = ex.getMessage();
            }

            retryCount++;
            store.updateFile(record.id(), FileUpdate.retryCount(retryCount));
            history.add(new RetryAttempt(attempt, clock.instant(), destination, lastError));
            LOGGER.warn("Attempt {}/{} for record {} failed: {}", attempt, maxAttempts, record.id(), lastError);
            if (attempt >= 2 && destination.equals(base)) {
                destination = DestinationPaths.alternate(base, clock.instant());
                LOGGER.info("Switching record {} to alternate destination {}", record.id(), destination);
            }
        }

        String message = truncate(lastError);
        store.updateFile(record.id(), FileUpdate.failed(message));
        if (config.recordFailures()) {
            store.insertFailure(new FailedUpload(record.id(), record.owner(), destination, history.size(),
                    maxAttempts, clock.instant(), message, history));
        }
        return lastWasTimeout ? Outcome.TIMEOUT : Outcome.ERROR;
    }

    /**
     * Probes every synced record of the owner against the object store.
     */
    public StorageVerification verify(String owner) {
        FileQuery query = FileQuery.forOwner(owner).withStatus(SyncStatus.SYNCED);
        Map<String, Set<String>> listings = new HashMap<>();
        List<MissingObject> missing = new ArrayList<>();
        int checked = 0;
        int offset = 0;
        List<FileRecord> page;
        do {
            page = store.findFiles(query, VERIFY_PAGE_SIZE, offset).files();
            for (FileRecord record : page) {
                checked++;
                String remotePath = record.remotePath();
                boolean present = remotePath != null && listings
                        .computeIfAbsent(DestinationPaths.parentPrefix(remotePath), this::listPaths)
                        .contains(remotePath);
                if (!present) {
                    missing.add(new MissingObject(record.id(), record.filename(), remotePath));
                }
            }
            offset += page.size();
        } while (page.size() == VERIFY_PAGE_SIZE);
        LOGGER.info("Verified {} synced records of {}: {} missing", checked, owner, missing.size());
        return new StorageVerification(checked, checked - missing.size(), missing);
    }

    /**
     * Marks records whose remote object disappeared as failed and uploads them again.
     */
    public RemediationResult remediate(String owner) {
        StorageVerification verification = verify(owner);
        List<FileRecord> requeued = new ArrayList<>();
        for (MissingObject object : verification.missing()) {
            store.updateFile(object.fileId(), FileUpdate.failed(MISSING_REMOTE)).ifPresent(requeued::add);
        }
        SyncStats resync = requeued.isEmpty() ? SyncStats.empty() : sync(requeued);
        return new RemediationResult(verification, requeued.size(), resync);
    }

    private void markFailed(FileRecord record, String message) {
        try {
            String error = message == null ? "Unexpected sync failure" : message;
            store.updateFile(record.id(), FileUpdate.failed(truncate(error)));
        } catch (RuntimeException ex) {
            LOGGER.warn("Failed to record sync error for {}", record.id(), ex);
        }
    }

    Duration timeoutFor(long size) {
        long scaledMillis = (long) ((double) size / TIMEOUT_CHUNK_BYTES * TIMEOUT_PER_CHUNK.toMillis());
        Duration scaled = Duration.ofMillis(scaledMillis);
        return scaled.compareTo(config.minTimeout()) > 0 ? scaled : config.minTimeout();
    }

    private Optional<Path> localSource(FileRecord record) {
        if (record.organizedPath() != null) {
            Path organized = Path.of(record.organizedPath());
            if (Files.isRegularFile(organized)) {
                return Optional.of(organized);
            }
        }
        Path local = Path.of(record.localPath());
        return Files.isRegularFile(local) ? Optional.of(local) : Optional.empty();
    }

    private boolean exists(String path) {
        return listPaths(DestinationPaths.parentPrefix(path)).contains(path);
    }

    private Set<String> listPaths(String prefix) {
        Set<String> paths = new HashSet<>();
        for (StoredObject object : objectStore.list(prefix)) {
            paths.add(object.path());
        }
        return paths;
    }

    private static String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }

    private enum Outcome {
        UPLOADED,
        SKIPPED,
        ERROR,
        TIMEOUT
    }
}

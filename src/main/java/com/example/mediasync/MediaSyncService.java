package com.example.mediasync;

import com.example.mediasync.metadata.FilePage;
import com.example.mediasync.metadata.FileQuery;
import com.example.mediasync.metadata.FileRecord;
import com.example.mediasync.metadata.FileStats;
import com.example.mediasync.metadata.MetadataStore;
import com.example.mediasync.metadata.SessionRecord;
import com.example.mediasync.scan.ActiveChat;
import com.example.mediasync.scan.FileOrganizer;
import com.example.mediasync.scan.IdentityReconciler;
import com.example.mediasync.scan.MediaFileInspector;
import com.example.mediasync.scan.MediaScanner;
import com.example.mediasync.scan.PhoneAttributor;
import com.example.mediasync.scan.ReconcileResult;
import com.example.mediasync.scan.ScanResult;
import com.example.mediasync.scan.ScanRoots;
import com.example.mediasync.session.RendererFactory;
import com.example.mediasync.session.SessionManager;
import com.example.mediasync.session.SessionPollResult;
import com.example.mediasync.session.SessionStartResult;
import com.example.mediasync.storage.ObjectStore;
import com.example.mediasync.storage.ObjectStoreException;
import com.example.mediasync.storage.RemediationResult;
import com.example.mediasync.storage.StorageVerification;
import com.example.mediasync.storage.SyncStats;
import com.example.mediasync.storage.UploadCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Caller-facing operations of the pipeline. Each call is synchronous and either returns a
 * JSON-shaped result or throws {@link MediaSyncException}.
 */
public final class MediaSyncService implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(MediaSyncService.class);
    private static final int MAX_PAGE_SIZE = 1000;
    private static final int DEFAULT_SYNC_LIMIT = 1000;

    private final MediaSyncConfig config;
    private final MetadataStore store;
    private final ObjectStore objectStore;
    private final SessionManager sessions;
    private final MediaScanner scanner;
    private final UploadCoordinator uploads;
    private final IdentityReconciler reconciler;
    private final ScanRoots scanRoots;

    public MediaSyncService(MediaSyncConfig config,
                            MetadataStore store,
                            ObjectStore objectStore,
                            RendererFactory rendererFactory,
                            Clock clock) {
        this(config, store, objectStore, rendererFactory, clock, ScanRoots.forCurrentSystem());
    }

    public MediaSyncService(MediaSyncConfig config,
                            MetadataStore store,
                            ObjectStore objectStore,
                            RendererFactory rendererFactory,
                            Clock clock,
                            ScanRoots scanRoots) {
        this.config = config;
        this.store = store;
        this.objectStore = objectStore;
        this.scanRoots = scanRoots;
        PhoneAttributor attributor = new PhoneAttributor();
        FileOrganizer organizer = new FileOrganizer(config.dataDirectory());
        this.sessions = new SessionManager(store, rendererFactory, config.session(), clock);
        this.scanner = new MediaScanner(new MediaFileInspector(), attributor, organizer);
        this.uploads = new UploadCoordinator(store, objectStore, config.upload(), clock);
        this.reconciler = new IdentityReconciler(store, attributor, organizer);
    }

    // --- Sessions ------------------------------------------------------------

    public SessionStartResult startSession(String owner, String deviceLabel) {
        requireOwner(owner);
        return sessions.start(owner, deviceLabel);
    }

    public SessionPollResult pollSession(String sessionId) {
        requireId(sessionId);
        return sessions.poll(sessionId);
    }

    public SessionRecord closeSession(String sessionId) {
        requireId(sessionId);
        return sessions.close(sessionId);
    }

    // --- Ingestion -----------------------------------------------------------

    /**
     * Scans the media roots and inserts records for content the owner does not have yet.
     */
    public ScanReport triggerScan(String owner) {
        requireOwner(owner);
        List<ActiveChat> chats = sessions.activeChats(owner);
        List<Path> roots = scanRoots.resolve(config.roots());
        ScanResult result = scanner.scan(owner, roots, chats, store.knownHashes(owner));
        int inserted = ingest(owner, result.records());
        LOGGER.info("Scan for {} discovered {} new files, inserted {}", owner, result.records().size(), inserted);
        return new ScanReport(result.records().size(), inserted, result.stats());
    }

    public SyncStats triggerSync(String owner) {
        return triggerSync(owner, DEFAULT_SYNC_LIMIT);
    }

    public SyncStats triggerSync(String owner, int limit) {
        requireOwner(owner);
        requireLimit(limit);
        List<FileRecord> pending = store.findUnsynced(owner, limit);
        LOGGER.info("Syncing {} records for {}", pending.size(), owner);
        return uploads.sync(pending);
    }

    /**
     * Ingests explicitly named files, then uploads the newly inserted ones.
     */
    public ImportReport importFiles(String owner, List<Path> files, String identityOverride) {
        requireOwner(owner);
        if (files == null || files.isEmpty()) {
            throw new MediaSyncException(ErrorKind.INVALID_REQUEST, "No files to import", owner);
        }
        List<ActiveChat> chats = sessions.activeChats(owner);
        Set<String> known = new HashSet<>(store.knownHashes(owner));
        List<FileRecord> candidates = new ArrayList<>();
        int alreadyKnown = 0;
        int failed = 0;
        for (Path file : files) {
            if (!Files.isRegularFile(file)) {
                LOGGER.warn("Import skipped {}: not a readable file", file);
                failed++;
                continue;
            }
            try {
                FileRecord record = scanner.recordFor(owner, file, identityOverride, chats);
                if (known.add(record.contentHash())) {
                    candidates.add(record);
                } else {
                    alreadyKnown++;
                }
            } catch (IOException ex) {
                LOGGER.warn("Import of {} failed", file, ex);
                failed++;
            }
        }
        List<FileRecord> inserted = insertBatched(candidates);
        SyncStats sync = inserted.isEmpty() ? SyncStats.empty() : uploads.sync(inserted);
        return new ImportReport(files.size(), inserted.size(), alreadyKnown, failed, sync);
    }

    public ReconcileResult reconcileIdentities(String owner) {
        requireOwner(owner);
        return reconciler.reconcile(owner);
    }

    // --- Queries -------------------------------------------------------------

    public FilePage listFiles(FileQuery query, int limit, int offset) {
        if (query == null) {
            throw new MediaSyncException(ErrorKind.INVALID_REQUEST, "A query is required", null);
        }
        requireOwner(query.owner());
        requireLimit(limit);
        if (offset < 0) {
            throw new MediaSyncException(ErrorKind.INVALID_REQUEST, "offset must not be negative", query.owner());
        }
        return store.findFiles(query, limit, offset);
    }

    /**
     * Files of the owner that have no confirmed remote copy yet.
     */
    public List<FileRecord> getMissingFiles(String owner, int limit) {
        requireOwner(owner);
        requireLimit(limit);
        return store.findUnsynced(owner, limit);
    }

    public FileStats getFileStats(String owner) {
        requireOwner(owner);
        return store.fileStats(owner);
    }

    public FileUrl getFileUrl(String owner, String fileId) {
        FileRecord record = ownedFile(owner, fileId);
        if (!record.isSynced() || record.remotePath() == null) {
            throw new MediaSyncException(ErrorKind.NOT_FOUND, "File has no remote copy", fileId);
        }
        String url = record.remoteUrl() != null ? record.remoteUrl() : objectStore.publicUrl(record.remotePath());
        return new FileUrl(fileId, record.remotePath(), url);
    }

    /**
     * Deletes the record. The remote object is removed only when no other record of the owner references it.
     */
    public DeleteReport deleteFile(String owner, String fileId) {
        FileRecord record = ownedFile(owner, fileId);
        boolean remoteDeleted = false;
        if (record.remotePath() != null && store.countByRemotePath(owner, record.remotePath()) <= 1) {
            try {
                objectStore.delete(record.remotePath());
                remoteDeleted = true;
            } catch (ObjectStoreException ex) {
                LOGGER.warn("Failed to delete remote object {} of {}", record.remotePath(), fileId, ex);
            }
        }
        store.deleteFile(fileId);
        LOGGER.info("Deleted file record {} (remote removed: {})", fileId, remoteDeleted);
        return new DeleteReport(fileId, remoteDeleted);
    }

    // --- Storage maintenance -------------------------------------------------

    public StorageVerification verifyStorage(String owner) {
        requireOwner(owner);
        try {
            return uploads.verify(owner);
        } catch (ObjectStoreException ex) {
            throw new MediaSyncException(ErrorKind.STORE_FAILURE, ex.getMessage(), owner, ex);
        }
    }

    public RemediationResult remediateMissing(String owner) {
        requireOwner(owner);
        try {
            return uploads.remediate(owner);
        } catch (ObjectStoreException ex) {
            throw new MediaSyncException(ErrorKind.STORE_FAILURE, ex.getMessage(), owner, ex);
        }
    }

    @Override
    public void close() {
        sessions.closeAll();
        objectStore.close();
        try {
            store.close();
        } catch (RuntimeException ex) {
            LOGGER.warn("Failed to close metadata store", ex);
        }
    }

    private int ingest(String owner, List<FileRecord> discovered) {
        // The persisted hashes are re-read right before inserting; they win over the scan's view.
        Set<String> persisted = new HashSet<>(store.knownHashes(owner));
        List<FileRecord> fresh = new ArrayList<>();
        for (FileRecord record : discovered) {
            if (persisted.add(record.contentHash())) {
                fresh.add(record);
            }
        }
        return insertBatched(fresh).size();
    }

    private List<FileRecord> insertBatched(List<FileRecord> records) {
        List<FileRecord> inserted = new ArrayList<>(records.size());
        int batchSize = config.insertBatchSize();
        for (int start = 0; start < records.size(); start += batchSize) {
            List<FileRecord> batch = records.subList(start, Math.min(start + batchSize, records.size()));
            inserted.addAll(store.insertFiles(batch));
        }
        return inserted;
    }

    private FileRecord ownedFile(String owner, String fileId) {
        requireOwner(owner);
        requireId(fileId);
        return store.findFile(fileId)
                .filter(record -> record.owner().equals(owner))
                .orElseThrow(() -> new MediaSyncException(ErrorKind.NOT_FOUND, "Unknown file", fileId));
    }

    private static void requireOwner(String owner) {
        if (owner == null || owner.isBlank()) {
            throw new MediaSyncException(ErrorKind.INVALID_REQUEST, "owner is required", null);
        }
    }

    private static void requireId(String id) {
        if (id == null || id.isBlank()) {
            throw new MediaSyncException(ErrorKind.INVALID_REQUEST, "id is required", null);
        }
    }

    private static void requireLimit(int limit) {
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new MediaSyncException(ErrorKind.INVALID_REQUEST,
                    "limit must be between 1 and " + MAX_PAGE_SIZE, null);
        }
    }
}

package com.example.mediasync.scan;

import com.example.mediasync.metadata.FileQuery;
import com.example.mediasync.metadata.FileRecord;
import com.example.mediasync.metadata.FileUpdate;
import com.example.mediasync.metadata.MetadataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Re-attributes records whose sender is still unknown using the folder markers of their local path.
 */
public final class IdentityReconciler {
    private static final Logger LOGGER = LoggerFactory.getLogger(IdentityReconciler.class);
    public static final int BATCH_LIMIT = 1000;

    private final MetadataStore store;
    private final PhoneAttributor attributor;
    private final FileOrganizer organizer;

    public IdentityReconciler(MetadataStore store, PhoneAttributor attributor, FileOrganizer organizer) {
        this.store = store;
        this.attributor = attributor;
        this.organizer = organizer;
    }

    public ReconcileResult reconcile(String owner) {
        List<FileRecord> unknown = store.findFiles(
                FileQuery.forOwner(owner).withSender(FileRecord.UNKNOWN_SENDER), BATCH_LIMIT, 0).files();
        int updated = 0;
        int organized = 0;
        int failed = 0;
        for (FileRecord record : unknown) {
            Optional<String> identity = attributor.folderIdentity(record.localPath());
            if (identity.isEmpty()) {
                continue;
            }
            try {
                String organizedPath = null;
                Path source = Path.of(record.localPath());
                if (Files.exists(source)) {
                    organizedPath = organizer
                            .organize(source, record.contentHash(), identity.get(), record.mediaCategory())
                            .map(Path::toString)
                            .orElse(null);
                }
                store.updateFile(record.id(), FileUpdate.sender(identity.get(), organizedPath));
                updated++;
                if (organizedPath != null) {
                    organized++;
                }
            } catch (IOException | RuntimeException ex) {
                LOGGER.warn("Failed to reconcile identity for {}", record.id(), ex);
                failed++;
            }
        }
        LOGGER.info("Reconciled {} of {} unknown records for {}", updated, unknown.size(), owner);
        return new ReconcileResult(unknown.size(), updated, organized, failed);
    }
}

package com.example.mediasync.metadata.jdbi;

import com.example.mediasync.metadata.FailedUpload;
import com.example.mediasync.metadata.FilePage;
import com.example.mediasync.metadata.FileQuery;
import com.example.mediasync.metadata.FileRecord;
import com.example.mediasync.metadata.FileStats;
import com.example.mediasync.metadata.FileUpdate;
import com.example.mediasync.metadata.MediaCategory;
import com.example.mediasync.metadata.RetryAttempt;
import com.example.mediasync.metadata.SessionRecord;
import com.example.mediasync.metadata.SessionStatus;
import com.example.mediasync.metadata.SyncStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbiMetadataStoreTest {
    private JdbiMetadataStore store;

    @BeforeEach
    void openStore() throws Exception {
        Path dir = Files.createTempDirectory("jdbi-store");
        store = new JdbiMetadataStore(MetadataDatabase.open("jdbc:sqlite:" + dir.resolve("nested/media.db")));
    }

    @AfterEach
    void closeStore() {
        store.close();
    }

    private static FileRecord file(String owner, String name, String hash, MediaCategory category, String sender) {
        return FileRecord.discovered(owner, name, "/media/" + name, null, hash, 100L,
                "application/octet-stream", category, sender);
    }

    @Test
    void insertsAndReadsBackRecords() {
        List<FileRecord> inserted = store.insertFiles(List.of(
                file("alice", "a.jpg", "h1", MediaCategory.IMAGE, "123"),
                file("alice", "b.pdf", "h2", MediaCategory.DOCUMENT, null)));

        assertEquals(2, inserted.size());
        FileRecord stored = store.findFile(inserted.get(1).id()).orElseThrow();
        assertEquals("b.pdf", stored.filename());
        assertEquals(MediaCategory.DOCUMENT, stored.mediaCategory());
        assertEquals(FileRecord.UNKNOWN_SENDER, stored.senderIdentity());
        assertEquals(SyncStatus.NOT_SYNCED, stored.syncStatus());
        assertNotNull(stored.createdAt());
        assertEquals(Set.of("h1", "h2"), store.knownHashes("alice"));
        assertTrue(store.knownHashes("bob").isEmpty());
    }

    @Test
    void filtersAndPaginates() {
        store.insertFiles(List.of(
                file("alice", "1.jpg", "h1", MediaCategory.IMAGE, "123"),
                file("alice", "2.jpg", "h2", MediaCategory.IMAGE, "123"),
                file("alice", "3.mp3", "h3", MediaCategory.AUDIO, "456"),
                file("bob", "4.jpg", "h4", MediaCategory.IMAGE, "123")));

        FilePage images = store.findFiles(FileQuery.forOwner("alice").withCategory(MediaCategory.IMAGE), 1, 0);
        assertEquals(2, images.total());
        assertEquals(1, images.files().size());
        assertTrue(images.hasMore());

        FilePage second = store.findFiles(FileQuery.forOwner("alice").withCategory(MediaCategory.IMAGE), 1, 1);
        assertFalse(second.hasMore());

        assertEquals(1, store.countFiles(FileQuery.forOwner("alice").withSender("456")));
        assertEquals(1, store.countFiles(FileQuery.forOwner("alice").withHash("h3")));
        assertEquals(3, store.countFiles(FileQuery.forOwner("alice")));
    }

    @Test
    void updatesStatusAndFindsSyncedTwin() {
        List<FileRecord> inserted = store.insertFiles(List.of(
                file("alice", "a.jpg", "same", MediaCategory.IMAGE, "123"),
                file("alice", "b.jpg", "same", MediaCategory.IMAGE, "123")));
        String first = inserted.get(0).id();
        String second = inserted.get(1).id();

        FileRecord synced = store.updateFile(first, FileUpdate.synced("123/a.jpg", "https://x/123/a.jpg")).orElseThrow();
        assertEquals(SyncStatus.SYNCED, synced.syncStatus());

        FileRecord twin = store.findSyncedByHash("alice", "same", second).orElseThrow();
        assertEquals(first, twin.id());
        assertTrue(store.findSyncedByHash("alice", "same", first).isEmpty());
        assertEquals(List.of(second), store.findUnsynced("alice", 10).stream().map(FileRecord::id).toList());
        assertEquals(1, store.countByRemotePath("alice", "123/a.jpg"));
        assertTrue(store.updateFile("missing-id", FileUpdate.retryCount(1)).isEmpty());
    }

    @Test
    void rejectsImplicitRevertToNotSynced() {
        String id = store.insertFiles(List.of(file("alice", "a.jpg", "h", MediaCategory.IMAGE, "1"))).get(0).id();
        store.updateFile(id, FileUpdate.synced("1/a.jpg", "u"));

        FileUpdate revert = new FileUpdate(SyncStatus.NOT_SYNCED, null, null, false, null, null, null, null);
        assertThrows(IllegalStateException.class, () -> store.updateFile(id, revert));
        assertEquals(SyncStatus.SYNCED, store.findFile(id).orElseThrow().syncStatus());
    }

    @Test
    void aggregatesStats() {
        List<FileRecord> inserted = store.insertFiles(List.of(
                file("alice", "1.jpg", "h1", MediaCategory.IMAGE, "123"),
                file("alice", "2.jpg", "h2", MediaCategory.IMAGE, "456"),
                file("alice", "3.mp4", "h3", MediaCategory.VIDEO, "123"),
                file("alice", "4.zip", "h4", MediaCategory.ARCHIVE, null)));
        store.updateFile(inserted.get(0).id(), FileUpdate.synced("123/1.jpg", "u"));
        store.updateFile(inserted.get(1).id(), FileUpdate.failed("boom"));

        FileStats stats = store.fileStats("alice");

        assertEquals(4, stats.totalFiles());
        assertEquals(1, stats.syncedFiles());
        assertEquals(1, stats.errorFiles());
        assertEquals(2, stats.pendingFiles());
        assertEquals(400, stats.totalSizeBytes());
        assertEquals(25.0, stats.percentSynced());
        assertEquals(2L, stats.mediaCategories().get(MediaCategory.IMAGE));
        assertEquals(2L, stats.senders().get("123"));
        assertEquals(1L, stats.senders().get(FileRecord.UNKNOWN_SENDER));
    }

    @Test
    void deletesRecords() {
        String id = store.insertFiles(List.of(file("alice", "a.jpg", "h", MediaCategory.IMAGE, "1"))).get(0).id();

        assertTrue(store.deleteFile(id));
        assertFalse(store.deleteFile(id));
        assertTrue(store.findFile(id).isEmpty());
    }

    @Test
    void persistsSessionTransitionsAndPayload() {
        SessionRecord session = store.insertSession(SessionRecord.opened("alice", "laptop"));
        assertEquals(SessionStatus.INACTIVE, session.status());

        store.updateSession(session.id(), SessionStatus.QR_PENDING, Map.of(SessionRecord.QR_CODE_KEY, "data:qr"));
        SessionRecord authenticated = store.updateSession(session.id(), SessionStatus.AUTHENTICATED, Map.of())
                .orElseThrow();

        SessionRecord reloaded = store.findSession(session.id()).orElseThrow();
        assertEquals(SessionStatus.AUTHENTICATED, reloaded.status());
        assertEquals("data:qr", reloaded.qrCode());
        assertEquals("laptop", reloaded.deviceLabel());
        assertNull(reloaded.expiresAt());
        assertEquals(authenticated.payload(), reloaded.payload());
        assertEquals(1, store.findSessions("alice").size());
        assertTrue(store.findSessions("bob").isEmpty());

        store.updateSession(session.id(), SessionStatus.CLOSED, Map.of());
        assertThrows(IllegalStateException.class,
                () -> store.updateSession(session.id(), SessionStatus.QR_PENDING, Map.of()));
    }

    @Test
    void storesFailureHistory() {
        Instant when = Instant.parse("2024-05-01T12:00:00Z");
        store.insertFailure(new FailedUpload("f1", "alice", "123/a_20240501120000.jpg", 3, 3, when, "exists",
                List.of(new RetryAttempt(1, when, "123/a.jpg", "exists"),
                        new RetryAttempt(2, when, "123/a.jpg", "exists"))));

        List<FailedUpload> failures = store.findFailures("alice");
        assertEquals(1, failures.size());
        assertEquals(3, failures.get(0).getAttempts());
        assertEquals(when, failures.get(0).getLastAttemptTime());
        assertEquals(2, failures.get(0).getRetryAttempts().size());
        assertEquals("123/a.jpg", failures.get(0).getRetryAttempts().get(1).getDestination());
        assertTrue(store.findFailures("bob").isEmpty());
    }
}

package com.example.mediasync.storage;

import com.example.mediasync.metadata.FailedUpload;
import com.example.mediasync.metadata.FileRecord;
import com.example.mediasync.metadata.InMemoryMetadataStore;
import com.example.mediasync.metadata.MediaCategory;
import com.example.mediasync.metadata.SyncStatus;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UploadCoordinatorTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T10:20:30Z"), ZoneOffset.UTC);
    private static final String STAMP = "20240601102030";

    private final InMemoryMetadataStore store = new InMemoryMetadataStore(CLOCK);
    private final RecordingObjectStore objects = new RecordingObjectStore();
    private final UploadCoordinator coordinator =
            new UploadCoordinator(store, objects, UploadConfig.defaults(), CLOCK);

    private FileRecord insert(Path file, String sender, String hash) throws Exception {
        FileRecord record = FileRecord.discovered("owner-1", file.getFileName().toString(), file.toString(), null,
                hash, Files.exists(file) ? Files.size(file) : 0L, "image/jpeg", MediaCategory.IMAGE, sender);
        return store.insertFiles(List.of(record)).get(0);
    }

    private FileRecord reload(FileRecord record) {
        return store.findFile(record.id()).orElseThrow();
    }

    private static Path media(String name, String content) throws Exception {
        Path dir = Files.createTempDirectory("upload-test");
        return Files.writeString(dir.resolve(name), content);
    }

    @Test
    void uploadsVerifiesAndMarksSynced() throws Exception {
        FileRecord record = insert(media("a.jpg", "alpha"), "123", "h1");

        SyncStats stats = coordinator.sync(List.of(record));

        assertEquals(new SyncStats(1, 1, 0, 0, 0), stats);
        FileRecord synced = reload(record);
        assertEquals(SyncStatus.SYNCED, synced.syncStatus());
        assertEquals("123/a.jpg", synced.remotePath());
        assertEquals(RecordingObjectStore.BASE_URL + "123/a.jpg", synced.remoteUrl());
        assertEquals(Duration.ofSeconds(30), objects.putTimeouts.get(0));
    }

    @Test
    void identicalContentIsUploadedOnce() throws Exception {
        FileRecord first = insert(media("a.jpg", "same"), "123", "same-hash");
        FileRecord second = insert(media("b.jpg", "same"), "123", "same-hash");

        SyncStats stats = coordinator.sync(List.of(first, second));

        assertEquals(1, objects.puts.size());
        assertEquals(1, stats.successful());
        assertEquals(1, stats.skippedDuplicates());
        assertEquals(reload(first).remoteUrl(), reload(second).remoteUrl());
        assertEquals(SyncStatus.SYNCED, reload(second).syncStatus());
    }

    @Test
    void collisionsMoveUploadToTimestampedName() throws Exception {
        FileRecord record = insert(media("a.jpg", "alpha"), "123", "h1");
        objects.collideOn("123/a.jpg");

        SyncStats stats = coordinator.sync(List.of(record));

        FileRecord synced = reload(record);
        assertEquals(SyncStatus.SYNCED, synced.syncStatus());
        assertEquals("123/a_" + STAMP + ".jpg", synced.remotePath());
        assertEquals(2, synced.retryCount());
        assertNull(synced.lastError());
        assertEquals(List.of("123/a.jpg", "123/a.jpg", "123/a_" + STAMP + ".jpg"), objects.puts);
        assertEquals(1, stats.successful());
    }

    @Test
    void missingLocalFileFailsWithoutRetry() throws Exception {
        Path gone = media("gone.jpg", "x");
        FileRecord record = insert(gone, "123", "h1");
        Files.delete(gone);

        SyncStats stats = coordinator.sync(List.of(record));

        FileRecord failed = reload(record);
        assertEquals(SyncStatus.SYNC_ERROR, failed.syncStatus());
        assertTrue(failed.lastError().contains("not found"));
        assertEquals(0, failed.retryCount());
        assertTrue(objects.puts.isEmpty());
        assertEquals(1, stats.errors());
    }

    @Test
    void failedVerificationExhaustsRetriesAndRecordsFailure() throws Exception {
        FileRecord record = insert(media("a.jpg", "alpha"), "123", "h1");
        objects.dropOn("123/a.jpg").dropOn("123/a_" + STAMP + ".jpg");

        SyncStats stats = coordinator.sync(List.of(record));

        FileRecord failed = reload(record);
        assertEquals(SyncStatus.SYNC_ERROR, failed.syncStatus());
        assertTrue(failed.lastError().startsWith("Upload verification failed"));
        assertEquals(3, failed.retryCount());
        assertEquals(1, stats.errors());
        List<FailedUpload> failures = store.findFailures("owner-1");
        assertEquals(1, failures.size());
        assertEquals(3, failures.get(0).getAttempts());
        assertEquals(3, failures.get(0).getMaxAttempts());
        assertEquals(3, failures.get(0).getRetryAttempts().size());
    }

    @Test
    void timeoutsAreCountedSeparately() throws Exception {
        FileRecord record = insert(media("a.jpg", "alpha"), "123", "h1");
        objects.timeoutOn("123/a.jpg").timeoutOn("123/a_" + STAMP + ".jpg");

        SyncStats stats = coordinator.sync(List.of(record));

        assertEquals(1, stats.timeouts());
        assertEquals(0, stats.errors());
        assertEquals(SyncStatus.SYNC_ERROR, reload(record).syncStatus());
    }

    @Test
    void existingRemoteObjectIsAdopted() throws Exception {
        FileRecord record = insert(media("a.jpg", "alpha"), "123", "h1");
        objects.seed("123/a.jpg");

        SyncStats stats = coordinator.sync(List.of(record));

        assertTrue(objects.puts.isEmpty());
        assertEquals(1, stats.skippedDuplicates());
        assertEquals("123/a.jpg", reload(record).remotePath());
    }

    @Test
    void unknownSenderUploadsUnderOwner() throws Exception {
        FileRecord record = insert(media("a.jpg", "alpha"), FileRecord.UNKNOWN_SENDER, "h1");

        coordinator.sync(List.of(record));

        assertEquals("owner-1/" + STAMP + "_a.jpg", reload(record).remotePath());
    }

    @Test
    void patienceScalesWithSize() {
        assertEquals(Duration.ofSeconds(30), coordinator.timeoutFor(1024));
        assertEquals(Duration.ofSeconds(300), coordinator.timeoutFor(100L * 1024 * 1024));
    }

    @Test
    void verifyAndRemediateMissingObjects() throws Exception {
        FileRecord kept = insert(media("a.jpg", "alpha"), "123", "h1");
        FileRecord lost = insert(media("b.jpg", "bravo"), "456", "h2");
        coordinator.sync(List.of(kept, lost));
        objects.remove("456/b.jpg");

        StorageVerification verification = coordinator.verify("owner-1");

        assertEquals(2, verification.checked());
        assertEquals(1, verification.present());
        assertEquals(lost.id(), verification.missing().get(0).fileId());

        RemediationResult remediation = coordinator.remediate("owner-1");

        assertEquals(1, remediation.requeued());
        assertEquals(1, remediation.resync().successful());
        assertTrue(objects.contains("456/b.jpg"));
        assertEquals(SyncStatus.SYNCED, reload(lost).syncStatus());
        assertEquals(0, coordinator.verify("owner-1").missing().size());
    }

    @Test
    void listingOutageIsRetriedAndRecorded() throws Exception {
        FileRecord record = insert(media("a.jpg", "alpha"), "123", "h1");
        objects.listFails = true;

        SyncStats stats = coordinator.sync(List.of(record));

        FileRecord failed = reload(record);
        assertEquals(SyncStatus.SYNC_ERROR, failed.syncStatus());
        assertTrue(failed.lastError().contains("listing unavailable"));
        assertEquals(3, failed.retryCount());
        assertTrue(objects.puts.isEmpty());
        assertEquals(1, stats.errors());
        assertEquals(1, store.findFailures("owner-1").size());
    }

    @Test
    void briefListingOutageRecoversOnRetry() throws Exception {
        FileRecord record = insert(media("a.jpg", "alpha"), "123", "h1");
        objects.transientListFailures = 1;

        SyncStats stats = coordinator.sync(List.of(record));

        FileRecord synced = reload(record);
        assertEquals(1, stats.successful());
        assertEquals(SyncStatus.SYNCED, synced.syncStatus());
        assertEquals("123/a.jpg", synced.remotePath());
        assertEquals(1, synced.retryCount());
    }
}

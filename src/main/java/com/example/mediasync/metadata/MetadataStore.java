package com.example.mediasync.metadata;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Typed access to the file, session and failure tables. Every metadata backend implements
 * this one interface; callers never probe an adapter for optional capabilities.
 */
public interface MetadataStore extends AutoCloseable {

    /**
     * Inserts the given records, assigning ids and timestamps, and returns the stored copies.
     */
    List<FileRecord> insertFiles(List<FileRecord> records);

    Optional<FileRecord> findFile(String id);

    /**
     * Applies a partial update and returns the updated record, or empty if the id is unknown.
     *
     * @throws IllegalStateException if the update would move the sync status backwards
     */
    Optional<FileRecord> updateFile(String id, FileUpdate update);

    /**
     * Returns one page of matching records, newest first.
     */
    FilePage findFiles(FileQuery query, int limit, int offset);

    long countFiles(FileQuery query);

    /**
     * Returns the owner's records that still need an upload ({@code not_synced} or {@code sync_error}).
     */
    List<FileRecord> findUnsynced(String owner, int limit);

    /**
     * Finds another synced record of the same owner holding identical content.
     */
    Optional<FileRecord> findSyncedByHash(String owner, String contentHash, String excludeId);

    Set<String> knownHashes(String owner);

    /**
     * Counts records of the owner that reference the given remote object.
     */
    long countByRemotePath(String owner, String remotePath);

    boolean deleteFile(String id);

    FileStats fileStats(String owner);

    SessionRecord insertSession(SessionRecord session);

    Optional<SessionRecord> findSession(String id);

    /**
     * Returns the owner's sessions, oldest first.
     */
    List<SessionRecord> findSessions(String owner);

    /**
     * Moves a session to {@code status} and merges {@code payloadPatch} into its payload.
     *
     * @throws IllegalStateException if the status change is not allowed
     */
    Optional<SessionRecord> updateSession(String id, SessionStatus status, Map<String, Object> payloadPatch);

    void insertFailure(FailedUpload failure);

    List<FailedUpload> findFailures(String owner);

    @Override
    default void close() {
        // no-op
    }
}

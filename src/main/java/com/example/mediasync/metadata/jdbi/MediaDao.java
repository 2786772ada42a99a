package com.example.mediasync.metadata.jdbi;

import com.example.mediasync.metadata.FileRecord;
import com.example.mediasync.metadata.SessionRecord;
import org.jdbi.v3.sqlobject.config.RegisterRowMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;
import java.util.Optional;
import java.util.Set;

@RegisterRowMapper(FileRecordMapper.class)
@RegisterRowMapper(SessionRecordMapper.class)
public interface MediaDao {

    String FILE_FILTER = """
             WHERE owner = :owner
               AND (:status IS NULL OR sync_status = :status)
               AND (:sender IS NULL OR sender_identity = :sender)
               AND (:category IS NULL OR media_category = :category)
               AND (:hash IS NULL OR content_hash = :hash)
            """;

    // --- Files ---------------------------------------------------------------

    @SqlQuery("SELECT * FROM files WHERE id = :id")
    Optional<FileRecord> findFile(@Bind("id") String id);

    @SqlQuery("SELECT * FROM files" + FILE_FILTER + " ORDER BY created_millis DESC LIMIT :limit OFFSET :offset")
    List<FileRecord> findFiles(@Bind("owner") String owner,
                               @Bind("status") String status,
                               @Bind("sender") String sender,
                               @Bind("category") String category,
                               @Bind("hash") String hash,
                               @Bind("limit") int limit,
                               @Bind("offset") int offset);

    @SqlQuery("SELECT COUNT(*) FROM files" + FILE_FILTER)
    long countFiles(@Bind("owner") String owner,
                    @Bind("status") String status,
                    @Bind("sender") String sender,
                    @Bind("category") String category,
                    @Bind("hash") String hash);

    @SqlQuery("""
        SELECT * FROM files
         WHERE owner = :owner
           AND sync_status <> 'synced'
         ORDER BY created_millis
         LIMIT :limit
        """)
    List<FileRecord> findUnsynced(@Bind("owner") String owner, @Bind("limit") int limit);

    @SqlQuery("""
        SELECT * FROM files
         WHERE owner = :owner
           AND content_hash = :hash
           AND sync_status = 'synced'
           AND id <> :excludeId
         ORDER BY updated_millis
         LIMIT 1
        """)
    Optional<FileRecord> findSyncedByHash(@Bind("owner") String owner,
                                          @Bind("hash") String hash,
                                          @Bind("excludeId") String excludeId);

    @SqlQuery("SELECT DISTINCT content_hash FROM files WHERE owner = :owner AND content_hash IS NOT NULL")
    Set<String> knownHashes(@Bind("owner") String owner);

    @SqlQuery("SELECT COUNT(*) FROM files WHERE owner = :owner AND remote_path = :remotePath")
    long countByRemotePath(@Bind("owner") String owner, @Bind("remotePath") String remotePath);

    @SqlUpdate("""
        UPDATE files
           SET organized_path  = :organizedPath,
               sender_identity = :senderIdentity,
               sync_status     = :syncStatus,
               retry_count     = :retryCount,
               last_error      = :lastError,
               remote_path     = :remotePath,
               remote_url      = :remoteUrl,
               updated_millis  = :updatedMillis
         WHERE id = :id
        """)
    int updateFile(@Bind("id") String id,
                   @Bind("organizedPath") String organizedPath,
                   @Bind("senderIdentity") String senderIdentity,
                   @Bind("syncStatus") String syncStatus,
                   @Bind("retryCount") int retryCount,
                   @Bind("lastError") String lastError,
                   @Bind("remotePath") String remotePath,
                   @Bind("remoteUrl") String remoteUrl,
                   @Bind("updatedMillis") long updatedMillis);

    @SqlUpdate("DELETE FROM files WHERE id = :id")
    int deleteFile(@Bind("id") String id);

    // --- Sessions ------------------------------------------------------------

    @SqlUpdate("""
        INSERT INTO sessions(id, owner, kind, device_label, status, payload_json, created_millis, updated_millis, expires_millis)
        VALUES(:id, :owner, :kind, :deviceLabel, :status, :payloadJson, :createdMillis, :updatedMillis, :expiresMillis)
        """)
    void insertSession(@Bind("id") String id,
                       @Bind("owner") String owner,
                       @Bind("kind") String kind,
                       @Bind("deviceLabel") String deviceLabel,
                       @Bind("status") String status,
                       @Bind("payloadJson") String payloadJson,
                       @Bind("createdMillis") long createdMillis,
                       @Bind("updatedMillis") long updatedMillis,
                       @Bind("expiresMillis") Long expiresMillis);

    @SqlQuery("SELECT * FROM sessions WHERE id = :id")
    Optional<SessionRecord> findSession(@Bind("id") String id);

    @SqlQuery("SELECT * FROM sessions WHERE owner = :owner ORDER BY created_millis, rowid")
    List<SessionRecord> findSessions(@Bind("owner") String owner);

    @SqlUpdate("""
        UPDATE sessions
           SET status         = :status,
               payload_json   = :payloadJson,
               updated_millis = :updatedMillis
         WHERE id = :id
        """)
    int updateSession(@Bind("id") String id,
                      @Bind("status") String status,
                      @Bind("payloadJson") String payloadJson,
                      @Bind("updatedMillis") long updatedMillis);

    // --- Upload failures -----------------------------------------------------

    @SqlUpdate("""
        INSERT INTO upload_failures(file_id, owner, destination, attempts, max_attempts, last_attempt_millis, last_error, attempts_json)
        VALUES(:fileId, :owner, :destination, :attempts, :maxAttempts, :lastAttemptMillis, :lastError, :attemptsJson)
        """)
    void insertFailure(@Bind("fileId") String fileId,
                       @Bind("owner") String owner,
                       @Bind("destination") String destination,
                       @Bind("attempts") int attempts,
                       @Bind("maxAttempts") int maxAttempts,
                       @Bind("lastAttemptMillis") long lastAttemptMillis,
                       @Bind("lastError") String lastError,
                       @Bind("attemptsJson") String attemptsJson);
}

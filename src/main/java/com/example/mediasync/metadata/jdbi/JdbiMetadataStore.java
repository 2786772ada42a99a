package com.example.mediasync.metadata.jdbi;

import com.example.mediasync.metadata.FailedUpload;
import com.example.mediasync.metadata.FilePage;
import com.example.mediasync.metadata.FileQuery;
import com.example.mediasync.metadata.FileRecord;
import com.example.mediasync.metadata.FileStats;
import com.example.mediasync.metadata.FileUpdate;
import com.example.mediasync.metadata.MediaCategory;
import com.example.mediasync.metadata.MetadataStore;
import com.example.mediasync.metadata.RetryAttempt;
import com.example.mediasync.metadata.SessionRecord;
import com.example.mediasync.metadata.SessionStatus;
import com.example.mediasync.metadata.SyncStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.statement.PreparedBatch;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

/**
 * {@link MetadataStore} backed by a relational database through Jdbi.
 */
public final class JdbiMetadataStore implements MetadataStore {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final MetadataDatabase database;
    private final Jdbi jdbi;
    private final Clock clock;

    public JdbiMetadataStore(MetadataDatabase database) {
        this(database, Clock.systemUTC());
    }

    public JdbiMetadataStore(MetadataDatabase database, Clock clock) {
        this.database = database;
        this.jdbi = database.jdbi();
        this.clock = clock;
    }

    @Override
    public List<FileRecord> insertFiles(List<FileRecord> records) {
        if (records.isEmpty()) {
            return List.of();
        }
        Instant now = clock.instant();
        List<FileRecord> stored = new ArrayList<>(records.size());
        for (FileRecord record : records) {
            String id = record.id() == null ? UUID.randomUUID().toString() : record.id();
            stored.add(record.persisted(id, now));
        }
        jdbi.useTransaction(handle -> {
            PreparedBatch batch = handle.prepareBatch("""
                    INSERT INTO files(id, owner, filename, local_path, organized_path, content_hash, size_bytes,
                                      content_type, media_category, sender_identity, sync_status, retry_count,
                                      last_error, remote_path, remote_url, created_millis, updated_millis)
                    VALUES(:id, :owner, :filename, :localPath, :organizedPath, :contentHash, :size,
                           :contentType, :category, :sender, :status, :retryCount,
                           :lastError, :remotePath, :remoteUrl, :created, :updated)
                    """);
            for (FileRecord record : stored) {
                batch.bind("id", record.id())
                        .bind("owner", record.owner())
                        .bind("filename", record.filename())
                        .bind("localPath", record.localPath())
                        .bind("organizedPath", record.organizedPath())
                        .bind("contentHash", record.contentHash())
                        .bind("size", record.size())
                        .bind("contentType", record.contentType())
                        .bind("category", record.mediaCategory().wireValue())
                        .bind("sender", record.senderIdentity())
                        .bind("status", record.syncStatus().wireValue())
                        .bind("retryCount", record.retryCount())
                        .bind("lastError", record.lastError())
                        .bind("remotePath", record.remotePath())
                        .bind("remoteUrl", record.remoteUrl())
                        .bind("created", record.createdAt().toEpochMilli())
                        .bind("updated", record.updatedAt().toEpochMilli())
                        .add();
            }
            batch.execute();
        });
        return stored;
    }

    @Override
    public Optional<FileRecord> findFile(String id) {
        return jdbi.withExtension(MediaDao.class, dao -> dao.findFile(id));
    }

    @Override
    public Optional<FileRecord> updateFile(String id, FileUpdate update) {
        return jdbi.inTransaction(handle -> {
            MediaDao dao = handle.attach(MediaDao.class);
            Optional<FileRecord> current = dao.findFile(id);
            if (current.isEmpty()) {
                return Optional.<FileRecord>empty();
            }
            FileRecord updated = update.applyTo(current.get(), clock.instant());
            dao.updateFile(
                    updated.id(),
                    updated.organizedPath(),
                    updated.senderIdentity(),
                    updated.syncStatus().wireValue(),
                    updated.retryCount(),
                    updated.lastError(),
                    updated.remotePath(),
                    updated.remoteUrl(),
                    updated.updatedAt().toEpochMilli());
            return Optional.of(updated);
        });
    }

    @Override
    public FilePage findFiles(FileQuery query, int limit, int offset) {
        return jdbi.withExtension(MediaDao.class, dao -> {
            List<FileRecord> files = dao.findFiles(query.owner(), status(query), query.senderIdentity(),
                    category(query), query.contentHash(), limit, offset);
            long total = dao.countFiles(query.owner(), status(query), query.senderIdentity(),
                    category(query), query.contentHash());
            return FilePage.of(files, total, limit, offset);
        });
    }

    @Override
    public long countFiles(FileQuery query) {
        return jdbi.withExtension(MediaDao.class, dao -> dao.countFiles(query.owner(), status(query),
                query.senderIdentity(), category(query), query.contentHash()));
    }

    @Override
    public List<FileRecord> findUnsynced(String owner, int limit) {
        return jdbi.withExtension(MediaDao.class, dao -> dao.findUnsynced(owner, limit));
    }

    @Override
    public Optional<FileRecord> findSyncedByHash(String owner, String contentHash, String excludeId) {
        return jdbi.withExtension(MediaDao.class, dao -> dao.findSyncedByHash(owner, contentHash, excludeId));
    }

    @Override
    public Set<String> knownHashes(String owner) {
        return jdbi.withExtension(MediaDao.class, dao -> dao.knownHashes(owner));
    }

    @Override
    public long countByRemotePath(String owner, String remotePath) {
        return jdbi.withExtension(MediaDao.class, dao -> dao.countByRemotePath(owner, remotePath));
    }

    @Override
    public boolean deleteFile(String id) {
        return jdbi.withExtension(MediaDao.class, dao -> dao.deleteFile(id)) > 0;
    }

    @Override
    public FileStats fileStats(String owner) {
        return jdbi.withHandle(handle -> {
            Map<String, Object> totals = handle.createQuery("""
                    SELECT COUNT(*) AS total,
                           COALESCE(SUM(CASE WHEN sync_status = 'synced' THEN 1 ELSE 0 END), 0) AS synced,
                           COALESCE(SUM(CASE WHEN sync_status = 'sync_error' THEN 1 ELSE 0 END), 0) AS errors,
                           COALESCE(SUM(size_bytes), 0) AS total_size
                      FROM files
                     WHERE owner = :owner
                    """)
                    .bind("owner", owner)
                    .mapToMap()
                    .one();
            Map<MediaCategory, Long> categories = new EnumMap<>(MediaCategory.class);
            groupCounts(handle, owner, "media_category")
                    .forEach((key, value) -> categories.merge(MediaCategory.fromWire(key), value, Long::sum));
            Map<String, Long> senders = new TreeMap<>(groupCounts(handle, owner, "sender_identity"));
            return FileStats.of(
                    asLong(totals.get("total")),
                    asLong(totals.get("synced")),
                    asLong(totals.get("errors")),
                    asLong(totals.get("total_size")),
                    categories,
                    senders);
        });
    }

    @Override
    public SessionRecord insertSession(SessionRecord session) {
        String id = session.id() == null ? UUID.randomUUID().toString() : session.id();
        SessionRecord stored = session.persisted(id, clock.instant());
        jdbi.useExtension(MediaDao.class, dao -> dao.insertSession(
                stored.id(),
                stored.owner(),
                stored.kind(),
                stored.deviceLabel(),
                stored.status().wireValue(),
                SessionRecordMapper.writePayload(stored.payload()),
                stored.createdAt().toEpochMilli(),
                stored.updatedAt().toEpochMilli(),
                stored.expiresAt() == null ? null : stored.expiresAt().toEpochMilli()));
        return stored;
    }

    @Override
    public Optional<SessionRecord> findSession(String id) {
        return jdbi.withExtension(MediaDao.class, dao -> dao.findSession(id));
    }

    @Override
    public List<SessionRecord> findSessions(String owner) {
        return jdbi.withExtension(MediaDao.class, dao -> dao.findSessions(owner));
    }

    @Override
    public Optional<SessionRecord> updateSession(String id, SessionStatus status, Map<String, Object> payloadPatch) {
        return jdbi.inTransaction(handle -> {
            MediaDao dao = handle.attach(MediaDao.class);
            Optional<SessionRecord> current = dao.findSession(id);
            if (current.isEmpty()) {
                return Optional.<SessionRecord>empty();
            }
            SessionRecord updated = current.get().transition(status, payloadPatch, clock.instant());
            dao.updateSession(id, updated.status().wireValue(),
                    SessionRecordMapper.writePayload(updated.payload()), updated.updatedAt().toEpochMilli());
            return Optional.of(updated);
        });
    }

    @Override
    public void insertFailure(FailedUpload failure) {
        String attemptsJson = writeAttempts(failure.getRetryAttempts());
        jdbi.useExtension(MediaDao.class, dao -> dao.insertFailure(
                failure.getFileId(),
                failure.getOwner(),
                failure.getDestination(),
                failure.getAttempts(),
                failure.getMaxAttempts(),
                failure.getLastAttemptTime().toEpochMilli(),
                failure.getLastError(),
                attemptsJson));
    }

    @Override
    public List<FailedUpload> findFailures(String owner) {
        return jdbi.withHandle(handle -> handle.createQuery("""
                        SELECT * FROM upload_failures WHERE owner = :owner ORDER BY id
                        """)
                .bind("owner", owner)
                .map((rs, ctx) -> new FailedUpload(
                        rs.getString("file_id"),
                        rs.getString("owner"),
                        rs.getString("destination"),
                        rs.getInt("attempts"),
                        rs.getInt("max_attempts"),
                        Instant.ofEpochMilli(rs.getLong("last_attempt_millis")),
                        rs.getString("last_error"),
                        readAttempts(rs.getString("attempts_json"))))
                .list());
    }

    @Override
    public void close() {
        database.close();
    }

    private static Map<String, Long> groupCounts(Handle handle, String owner, String column) {
        Map<String, Long> counts = new TreeMap<>();
        handle.createQuery("SELECT " + column + " AS grp, COUNT(*) AS cnt FROM files WHERE owner = :owner GROUP BY " + column)
                .bind("owner", owner)
                .map((rs, ctx) -> Map.entry(rs.getString("grp"), rs.getLong("cnt")))
                .forEach(entry -> counts.put(entry.getKey(), entry.getValue()));
        return counts;
    }

    private static long asLong(Object value) {
        return value == null ? 0L : ((Number) value).longValue();
    }

    private static String status(FileQuery query) {
        SyncStatus status = query.syncStatus();
        return status == null ? null : status.wireValue();
    }

    private static String category(FileQuery query) {
        MediaCategory category = query.mediaCategory();
        return category == null ? null : category.wireValue();
    }

    private static String writeAttempts(List<RetryAttempt> attempts) {
        ArrayNode array = MAPPER.createArrayNode();
        for (RetryAttempt attempt : attempts) {
            ObjectNode node = array.addObject();
            node.put("attempt", attempt.getAttempt());
            node.put("timestamp", attempt.getTimestamp().toEpochMilli());
            node.put("destination", attempt.getDestination());
            node.put("error", attempt.getError());
        }
        return array.toString();
    }

    private static List<RetryAttempt> readAttempts(String json) {
        List<RetryAttempt> attempts = new ArrayList<>();
        if (json == null || json.isBlank()) {
            return attempts;
        }
        try {
            for (JsonNode node : MAPPER.readTree(json)) {
                attempts.add(new RetryAttempt(
                        node.path("attempt").asInt(),
                        Instant.ofEpochMilli(node.path("timestamp").asLong()),
                        node.path("destination").asText(null),
                        node.path("error").asText(null)));
            }
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Corrupt retry history", ex);
        }
        return attempts;
    }
}

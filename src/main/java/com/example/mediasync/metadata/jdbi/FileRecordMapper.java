package com.example.mediasync.metadata.jdbi;

import com.example.mediasync.metadata.FileRecord;
import com.example.mediasync.metadata.MediaCategory;
import com.example.mediasync.metadata.SyncStatus;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;

public final class FileRecordMapper implements RowMapper<FileRecord> {
    @Override
    public FileRecord map(ResultSet rs, StatementContext ctx) throws SQLException {
        return new FileRecord(
                rs.getString("id"),
                rs.getString("owner"),
                rs.getString("filename"),
                rs.getString("local_path"),
                rs.getString("organized_path"),
                rs.getString("content_hash"),
                rs.getLong("size_bytes"),
                rs.getString("content_type"),
                MediaCategory.fromWire(rs.getString("media_category")),
                rs.getString("sender_identity"),
                SyncStatus.fromWire(rs.getString("sync_status")),
                rs.getInt("retry_count"),
                rs.getString("last_error"),
                rs.getString("remote_path"),
                rs.getString("remote_url"),
                Instant.ofEpochMilli(rs.getLong("created_millis")),
                Instant.ofEpochMilli(rs.getLong("updated_millis"))
        );
    }
}

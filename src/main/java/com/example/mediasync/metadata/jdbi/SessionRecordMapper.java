package com.example.mediasync.metadata.jdbi;

import com.example.mediasync.metadata.SessionRecord;
import com.example.mediasync.metadata.SessionStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Map;

public final class SessionRecordMapper implements RowMapper<SessionRecord> {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    @Override
    public SessionRecord map(ResultSet rs, StatementContext ctx) throws SQLException {
        long expires = rs.getLong("expires_millis");
        Instant expiresAt = rs.wasNull() ? null : Instant.ofEpochMilli(expires);
        return new SessionRecord(
                rs.getString("id"),
                rs.getString("owner"),
                rs.getString("kind"),
                rs.getString("device_label"),
                SessionStatus.fromWire(rs.getString("status")),
                readPayload(rs.getString("payload_json")),
                Instant.ofEpochMilli(rs.getLong("created_millis")),
                Instant.ofEpochMilli(rs.getLong("updated_millis")),
                expiresAt
        );
    }

    static Map<String, Object> readPayload(String json) throws SQLException {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return MAPPER.readValue(json, PAYLOAD_TYPE);
        } catch (JsonProcessingException ex) {
            throw new SQLException("Corrupt session payload", ex);
        }
    }

    static String writePayload(Map<String, Object> payload) {
        try {
            return MAPPER.writeValueAsString(payload == null ? Map.of() : payload);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Session payload is not serializable", ex);
        }
    }
}

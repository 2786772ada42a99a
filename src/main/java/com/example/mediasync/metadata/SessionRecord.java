package com.example.mediasync.metadata;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persisted state of one web-client session owned by an account.
 */
public record SessionRecord(
        String id,
        String owner,
        String kind,
        String deviceLabel,
        SessionStatus status,
        Map<String, Object> payload,
        Instant createdAt,
        Instant updatedAt,
        Instant expiresAt
) {
    public static final String KIND_WEB_CLIENT = "whatsapp_web";
    public static final String QR_CODE_KEY = "qr_code_data";
    public static final String LAST_ERROR_KEY = "last_error";
    public static final String QR_REFRESHED_KEY = "qr_refreshed_at";

    public static SessionRecord opened(String owner, String deviceLabel) {
        return new SessionRecord(null, owner, KIND_WEB_CLIENT, deviceLabel, SessionStatus.INACTIVE,
                Map.of(), null, null, null);
    }

    public SessionRecord persisted(String newId, Instant now) {
        return new SessionRecord(newId, owner, kind, deviceLabel, status, payload, now, now, expiresAt);
    }

    /**
     * Returns a copy moved to {@code next} with {@code payloadPatch} merged into the payload.
     * Staying in the same state only merges the payload.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    public SessionRecord transition(SessionStatus next, Map<String, Object> payloadPatch, Instant now) {
        if (next != status && !status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Illegal session transition " + status.wireValue() + " -> " + next.wireValue() + " for " + id);
        }
        Map<String, Object> merged = new LinkedHashMap<>(payload == null ? Map.of() : payload);
        if (payloadPatch != null) {
            merged.putAll(payloadPatch);
        }
        return new SessionRecord(id, owner, kind, deviceLabel, next, merged, createdAt, now, expiresAt);
    }

    public String qrCode() {
        Object value = payload == null ? null : payload.get(QR_CODE_KEY);
        return value == null ? null : value.toString();
    }
}

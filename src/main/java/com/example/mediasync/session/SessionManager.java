package com.example.mediasync.session;

import com.example.mediasync.ErrorKind;
import com.example.mediasync.MediaSyncException;
import com.example.mediasync.OperationError;
import com.example.mediasync.metadata.MetadataStore;
import com.example.mediasync.metadata.SessionRecord;
import com.example.mediasync.metadata.SessionStatus;
import com.example.mediasync.scan.ActiveChat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Drives web-client sessions through QR pairing and authentication detection.
 * At most one live renderer is held per owner.
 */
public final class SessionManager implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(SessionManager.class);
    static final String QR_SCRIPT = "return arguments[0].toDataURL('image/png');";
    private static final String DATA_URL_PREFIX = "data:image/png;base64,";

    private final MetadataStore store;
    private final RendererFactory rendererFactory;
    private final AuthenticationProbe probe;
    private final ActiveChatReader chatReader;
    private final SessionConfig config;
    private final Clock clock;
    private final Map<String, LiveHandle> handlesByOwner = new HashMap<>();

    public SessionManager(MetadataStore store, RendererFactory rendererFactory, SessionConfig config, Clock clock) {
        this.store = store;
        this.rendererFactory = rendererFactory;
        this.config = config;
        this.clock = clock;
        this.probe = new AuthenticationProbe(config);
        this.chatReader = new ActiveChatReader(clock);
    }

    public synchronized SessionStartResult start(String owner, String deviceLabel) {
        LiveHandle previous = handlesByOwner.remove(owner);
        if (previous != null) {
            LOGGER.info("Closing previous session {} of {}", previous.sessionId, owner);
            release(previous);
        }

        Renderer renderer = acquire(owner);
        SessionRecord session;
        try {
            session = store.insertSession(SessionRecord.opened(owner, deviceLabel));
        } catch (RuntimeException ex) {
            quitQuietly(renderer);
            throw ex;
        }
        handlesByOwner.put(owner, new LiveHandle(session.id(), renderer));
        LOGGER.info("Started session {} for {}", session.id(), owner);

        if (probe.probe(renderer).isAuthenticated()) {
            update(session.id(), SessionStatus.AUTHENTICATED, Map.of());
            return new SessionStartResult(session.id(), SessionStatus.AUTHENTICATED, true, null, null);
        }

        Optional<String> qr = awaitQr(renderer, config.qrTimeout());
        if (qr.isPresent()) {
            update(session.id(), SessionStatus.QR_PENDING, qrPayload(qr.get()));
            return new SessionStartResult(session.id(), SessionStatus.QR_PENDING, false, qr.get(), null);
        }

        if (probe.probe(renderer).isAuthenticated()) {
            update(session.id(), SessionStatus.AUTHENTICATED, Map.of());
            return new SessionStartResult(session.id(), SessionStatus.AUTHENTICATED, true, null, null);
        }

        String message = "QR code did not appear within " + config.qrTimeout().toSeconds() + "s";
        LOGGER.warn("Session {}: {}", session.id(), message);
        update(session.id(), SessionStatus.ERROR, Map.of(SessionRecord.LAST_ERROR_KEY, message));
        return new SessionStartResult(session.id(), SessionStatus.ERROR, false, null,
                new OperationError(ErrorKind.PROBE_TIMEOUT, message, session.id()));
    }

    public synchronized SessionPollResult poll(String sessionId) {
        SessionRecord session = liveSession(sessionId);
        Renderer renderer = rendererFor(session);

        try {
            renderer.refresh();
        } catch (RendererException ex) {
            LOGGER.debug("Refresh of session {} failed", sessionId, ex);
        }

        if (probe.probe(renderer).isAuthenticated()) {
            update(sessionId, SessionStatus.AUTHENTICATED, Map.of());
            return new SessionPollResult(sessionId, SessionStatus.AUTHENTICATED, true, session.qrCode());
        }

        SessionStatus status = session.status();
        if (status == SessionStatus.AUTHENTICATED) {
            status = update(sessionId, SessionStatus.ERROR,
                    Map.of(SessionRecord.LAST_ERROR_KEY, "Authentication lost")).status();
        }
        Optional<String> qr = awaitQr(renderer, config.pollQrTimeout());
        if (qr.isPresent()) {
            update(sessionId, SessionStatus.QR_PENDING, qrPayload(qr.get()));
            return new SessionPollResult(sessionId, SessionStatus.QR_PENDING, false, qr.get());
        }
        return new SessionPollResult(sessionId, status, false, null);
    }

    /**
     * Quits the session's renderer and marks it closed. Closing a closed session does nothing.
     */
    public synchronized SessionRecord close(String sessionId) {
        SessionRecord session = store.findSession(sessionId)
                .orElseThrow(() -> new MediaSyncException(ErrorKind.NOT_FOUND, "Unknown session", sessionId));
        LiveHandle handle = handlesByOwner.get(session.owner());
        if (handle != null && handle.sessionId.equals(sessionId)) {
            handlesByOwner.remove(session.owner());
            quit(handle);
        }
        if (session.status() == SessionStatus.CLOSED) {
            return session;
        }
        LOGGER.info("Closed session {}", sessionId);
        return update(sessionId, SessionStatus.CLOSED, Map.of());
    }

    /**
     * Chats of the owner's live authenticated session, or an empty list without one.
     */
    public synchronized List<ActiveChat> activeChats(String owner) {
        LiveHandle handle = handlesByOwner.get(owner);
        if (handle == null) {
            return List.of();
        }
        Optional<SessionRecord> session = store.findSession(handle.sessionId);
        if (session.isEmpty() || session.get().status() != SessionStatus.AUTHENTICATED) {
            return List.of();
        }
        return chatReader.read(handle.renderer);
    }

    public synchronized boolean hasLiveHandle(String owner) {
        return handlesByOwner.containsKey(owner);
    }

    public synchronized void closeAll() {
        List<LiveHandle> handles = new ArrayList<>(handlesByOwner.values());
        handlesByOwner.clear();
        for (LiveHandle handle : handles) {
            try {
                release(handle);
            } catch (RuntimeException ex) {
                LOGGER.warn("Failed to close session {}", handle.sessionId, ex);
            }
        }
    }

    @Override
    public void close() {
        closeAll();
    }

    private SessionRecord liveSession(String sessionId) {
        SessionRecord session = store.findSession(sessionId)
                .orElseThrow(() -> new MediaSyncException(ErrorKind.NOT_FOUND, "Unknown session", sessionId));
        if (session.status() == SessionStatus.CLOSED) {
            throw new MediaSyncException(ErrorKind.SESSION_CLOSED, "Session is closed", sessionId);
        }
        return session;
    }

    private Renderer rendererFor(SessionRecord session) {
        LiveHandle handle = handlesByOwner.get(session.owner());
        if (handle != null && handle.sessionId.equals(session.id())) {
            return handle.renderer;
        }
        if (handle != null) {
            handlesByOwner.remove(session.owner());
            release(handle);
        }
        Renderer renderer = acquire(session.owner());
        handlesByOwner.put(session.owner(), new LiveHandle(session.id(), renderer));
        return renderer;
    }

    private Renderer acquire(String owner) {
        Renderer renderer;
        try {
            renderer = rendererFactory.open();
        } catch (RendererException ex) {
            throw new MediaSyncException(ErrorKind.CAPABILITY_UNAVAILABLE,
                    "Renderer unavailable: " + ex.getMessage(), owner, ex);
        }
        try {
            renderer.open(config.entryUrl());
        } catch (RendererException ex) {
            quitQuietly(renderer);
            throw new MediaSyncException(ErrorKind.CAPABILITY_UNAVAILABLE,
                    "Unable to open " + config.entryUrl() + ": " + ex.getMessage(), owner, ex);
        }
        return renderer;
    }

    private Optional<String> awaitQr(Renderer renderer, Duration timeout) {
        Optional<PageElement> element;
        try {
            element = renderer.find(config.qrSelector(), timeout);
        } catch (RendererException ex) {
            LOGGER.debug("QR lookup failed", ex);
            return Optional.empty();
        }
        if (element.isEmpty()) {
            return Optional.empty();
        }
        try {
            Object data = renderer.execute(QR_SCRIPT, element.get());
            if (data instanceof String && ((String) data).startsWith("data:image")) {
                return Optional.of((String) data);
            }
        } catch (RendererException ex) {
            LOGGER.debug("QR extraction script failed; falling back to a screenshot", ex);
        }
        try {
            return Optional.of(DATA_URL_PREFIX + Base64.getEncoder().encodeToString(renderer.screenshot()));
        } catch (RendererException ex) {
            LOGGER.warn("Unable to capture QR code", ex);
            return Optional.empty();
        }
    }

    private Map<String, Object> qrPayload(String qr) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(SessionRecord.QR_CODE_KEY, qr);
        payload.put(SessionRecord.QR_REFRESHED_KEY, clock.instant().toString());
        return payload;
    }

    private SessionRecord update(String sessionId, SessionStatus status, Map<String, Object> patch) {
        return store.updateSession(sessionId, status, patch)
                .orElseThrow(() -> new MediaSyncException(ErrorKind.NOT_FOUND, "Unknown session", sessionId));
    }

    private void release(LiveHandle handle) {
        quit(handle);
        Optional<SessionRecord> session = store.findSession(handle.sessionId);
        if (session.isPresent() && session.get().status() != SessionStatus.CLOSED) {
            update(handle.sessionId, SessionStatus.CLOSED, Map.of());
        }
    }

    private void quit(LiveHandle handle) {
        quitQuietly(handle.renderer);
    }

    private static void quitQuietly(Renderer renderer) {
        try {
            renderer.quit();
        } catch (RendererException ex) {
            LOGGER.warn("Renderer did not quit cleanly", ex);
        }
    }

    private static final class LiveHandle {
        private final String sessionId;
        private final Renderer renderer;

        private LiveHandle(String sessionId, Renderer renderer) {
            this.sessionId = sessionId;
            this.renderer = renderer;
        }
    }
}

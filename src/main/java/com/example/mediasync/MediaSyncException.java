package com.example.mediasync;

/**
 * Failure that crosses the service boundary. Carries the kind and the id of the affected
 * file or session so callers never need to inspect a stack trace.
 */
public class MediaSyncException extends RuntimeException {
    private final ErrorKind kind;
    private final String affectedId;

    public MediaSyncException(ErrorKind kind, String message, String affectedId) {
        super(message);
        this.kind = kind;
        this.affectedId = affectedId;
    }

    public MediaSyncException(ErrorKind kind, String message, String affectedId, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.affectedId = affectedId;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getAffectedId() {
        return affectedId;
    }

    public OperationError toError() {
        return new OperationError(kind, getMessage(), affectedId);
    }
}

package com.example.mediasync.storage;

/**
 * A store request did not complete within its call timeout.
 */
public class ObjectStoreTimeoutException extends ObjectStoreException {
    public ObjectStoreTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}

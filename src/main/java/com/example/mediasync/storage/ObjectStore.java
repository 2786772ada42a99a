package com.example.mediasync.storage;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Remote object storage addressed by slash-separated paths.
 * Failures surface as {@link ObjectStoreException}.
 */
public interface ObjectStore extends AutoCloseable {

    /**
     * Uploads {@code file} unless an object already occupies {@code path}.
     */
    PutStatus put(String path, Path file, String contentType, Duration timeout);

    List<StoredObject> list(String prefix);

    String publicUrl(String path);

    void delete(String path);

    @Override
    default void close() {
        // no-op
    }
}

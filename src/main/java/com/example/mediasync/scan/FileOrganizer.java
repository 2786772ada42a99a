package com.example.mediasync.scan;

import com.example.mediasync.metadata.FileRecord;
import com.example.mediasync.metadata.MediaCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Copies attributed files into {@code <dataDir>/organized/<identity>/<category>/<filename>}.
 */
public final class FileOrganizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(FileOrganizer.class);

    private final Path organizedRoot;

    public FileOrganizer(Path dataDirectory) {
        this.organizedRoot = dataDirectory.resolve("organized");
    }

    /**
     * Returns the organized copy, creating it when absent. An existing file under the same name is reused only
     * when its content hash matches; otherwise the copy goes to {@code <stem>_<hash8><ext>}.
     * Files with an unknown sender are left in place.
     */
    public Optional<Path> organize(Path source, String contentHash, String identity, MediaCategory category)
            throws IOException {
        if (identity == null || identity.isBlank() || FileRecord.UNKNOWN_SENDER.equals(identity)) {
            return Optional.empty();
        }
        String hash = contentHash != null ? contentHash : MediaFileInspector.sha256(source);
        String filename = source.getFileName().toString();
        Path destination = destinationFor(identity, category, filename);
        if (Files.exists(destination)) {
            if (hash.equals(MediaFileInspector.sha256(destination))) {
                return Optional.of(destination);
            }
            destination = destinationFor(identity, category, hashedName(filename, hash));
            if (Files.exists(destination) && hash.equals(MediaFileInspector.sha256(destination))) {
                return Optional.of(destination);
            }
            LOGGER.debug("Organized name {} is taken by other content; using {}", filename, destination);
        }
        Files.createDirectories(destination.getParent());
        Files.copy(source, destination, StandardCopyOption.COPY_ATTRIBUTES, StandardCopyOption.REPLACE_EXISTING);
        LOGGER.debug("Organized {} -> {}", source, destination);
        return Optional.of(destination);
    }

    public Path destinationFor(String identity, MediaCategory category, String filename) {
        return organizedRoot.resolve(safeSegment(identity)).resolve(category.wireValue()).resolve(filename);
    }

    static String hashedName(String filename, String hash) {
        int dot = filename.lastIndexOf('.');
        String stem = dot <= 0 ? filename : filename.substring(0, dot);
        String extension = dot <= 0 ? "" : filename.substring(dot);
        return stem + "_" + hash.substring(0, Math.min(8, hash.length())) + extension;
    }

    static String safeSegment(String identity) {
        return identity.replaceAll("[^A-Za-z0-9+._-]", "_");
    }
}

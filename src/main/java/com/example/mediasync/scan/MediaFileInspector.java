package com.example.mediasync.scan;

import org.apache.tika.Tika;
import org.apache.tika.mime.MediaType;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;

/**
 * Reads size, timestamps, content type, category and content hash of one file.
 */
public class MediaFileInspector {
    public static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    private final Tika tika;

    public MediaFileInspector() {
        this(new Tika());
    }

    public MediaFileInspector(Tika tika) {
        this.tika = tika;
    }

    public InspectedFile inspect(Path path) throws IOException {
        BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        Instant created = attributes.creationTime().toInstant();
        Instant modified = attributes.lastModifiedTime().toInstant();
        Instant effective = created.isAfter(modified) ? created : modified;
        String filename = path.getFileName().toString();
        return new InspectedFile(
                path,
                filename,
                attributes.size(),
                effective,
                detectContentType(path),
                MediaCatalog.categoryOf(filename),
                sha256(path)
        );
    }

    public String detectContentType(Path path) {
        try {
            MediaType mediaType = MediaType.parse(tika.detect(path));
            return mediaType == null ? DEFAULT_CONTENT_TYPE : mediaType.toString();
        } catch (IOException ex) {
            return DEFAULT_CONTENT_TYPE;
        }
    }

    public static String sha256(Path path) throws IOException {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        try (InputStream inputStream = Files.newInputStream(path)) {
            byte[] buffer = new byte[8192];
            int read;
            while ((read = inputStream.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        byte[] hash = digest.digest();
        StringBuilder builder = new StringBuilder(hash.length * 2);
        for (byte b : hash) {
            builder.append(String.format("%02x", b));
        }
        return builder.toString();
    }
}

package com.example.mediasync.scan;

import com.example.mediasync.metadata.MediaCategory;
import org.apache.tika.Tika;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MediaFileInspectorTest {
    @Test
    void detectsContentTypeAndHash() throws Exception {
        Path tempDir = Files.createTempDirectory("inspector-test");
        Path pngFile = tempDir.resolve("image.png");
        byte[] pngHeader = new byte[] {(byte) 0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A};
        Files.write(pngFile, pngHeader);

        InspectedFile inspected = new MediaFileInspector(new Tika()).inspect(pngFile);

        assertTrue(inspected.contentType().contains("png"));
        assertEquals("image.png", inspected.filename());
        assertEquals(MediaCategory.IMAGE, inspected.category());
        assertEquals(8L, inspected.size());
        assertEquals(64, inspected.contentHash().length());
    }

    @Test
    void hashIsStableForEqualContent() throws Exception {
        Path tempDir = Files.createTempDirectory("inspector-hash");
        Path first = Files.writeString(tempDir.resolve("a.txt"), "hello", StandardCharsets.UTF_8);
        Path second = Files.writeString(tempDir.resolve("b.txt"), "hello", StandardCharsets.UTF_8);
        Path third = Files.writeString(tempDir.resolve("c.txt"), "world", StandardCharsets.UTF_8);

        assertEquals("2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824",
                MediaFileInspector.sha256(first));
        assertEquals(MediaFileInspector.sha256(first), MediaFileInspector.sha256(second));
        assertFalse(MediaFileInspector.sha256(first).equals(MediaFileInspector.sha256(third)));
    }

    @Test
    void effectiveTimestampIsNotBeforeModification() throws Exception {
        Path tempDir = Files.createTempDirectory("inspector-time");
        Path file = Files.writeString(tempDir.resolve("doc.pdf"), "%PDF-1.4");
        Instant modified = Instant.parse("2030-01-01T00:00:00Z");
        Files.setLastModifiedTime(file, FileTime.from(modified));

        InspectedFile inspected = new MediaFileInspector().inspect(file);

        assertFalse(inspected.effectiveTimestamp().isBefore(modified));
    }
}

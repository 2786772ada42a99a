package com.example.mediasync.scan;

import com.example.mediasync.metadata.MediaCategory;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MediaCatalogTest {
    @Test
    void classifiesByExtensionIgnoringCase() {
        assertEquals(MediaCategory.IMAGE, MediaCatalog.categoryOf("photo.HEIC"));
        assertEquals(MediaCategory.DOCUMENT, MediaCatalog.categoryOf("sheet.numbers"));
        assertEquals(MediaCategory.AUDIO, MediaCatalog.categoryOf("PTT-20230101-WA0001.opus"));
        assertEquals(MediaCategory.VIDEO, MediaCatalog.categoryOf("clip.3gp"));
        assertEquals(MediaCategory.ARCHIVE, MediaCatalog.categoryOf("backup.7z"));
        assertEquals(MediaCategory.OTHER, MediaCatalog.categoryOf("notes"));
    }

    @Test
    void acceptsClientNamedFilesWithoutKnownExtension() {
        assertTrue(MediaCatalog.isCandidate("IMG-20230615-WA0003"));
        assertTrue(MediaCatalog.isCandidate("whatsapp document.bin"));
        assertTrue(MediaCatalog.isCandidate("movie.mp4"));
        assertFalse(MediaCatalog.isCandidate("build.log"));
    }

    @Test
    void hiddenFilesAreDetected() {
        assertTrue(MediaCatalog.isHidden(".DS_Store"));
        assertFalse(MediaCatalog.isHidden("a.jpg"));
        assertEquals("", MediaCatalog.extensionOf(".profile"));
    }
}

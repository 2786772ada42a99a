package com.example.mediasync.scan;

import com.example.mediasync.metadata.FileRecord;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PhoneAttributorTest {
    private static final Instant FILE_TIME = Instant.parse("2023-06-15T12:00:00Z");
    private final PhoneAttributor attributor = new PhoneAttributor();

    @Test
    void folderMarkerWinsOverFilename() {
        String path = "/media/4915112345678@s.whatsapp.net/IMG-20230615-WA0003 from +15551234567.jpg";

        assertEquals("4915112345678", attributor.attribute(path, FILE_TIME, List.of()));
    }

    @Test
    void statusFolderMarker() {
        assertEquals("447700900123", attributor.attribute("/m/447700900123@status/x.jpg", FILE_TIME, List.of()));
    }

    @Test
    void filenameTemplatesInOrder() {
        assertEquals("15551234567",
                attributor.attribute("IMG-20230615-WA0003 from +15551234567.jpg", FILE_TIME, List.of()));
        assertEquals("4412345",
                attributor.attribute("Voice note from (4412345).opus", FILE_TIME, List.of()));
        assertEquals("9876543210",
                attributor.attribute("doc from 9876543210 final.pdf", FILE_TIME, List.of()));
        assertEquals("1234567890",
                attributor.attribute("/any/dir/1234567890.jpg", FILE_TIME, List.of()));
        assertEquals("15550001111",
                attributor.attribute("WhatsApp Image 15550001111 copy", FILE_TIME, List.of()));
    }

    @Test
    void closestChatWithinWindow() {
        List<ActiveChat> chats = List.of(
                new ActiveChat("111", "Alice", FILE_TIME.minus(Duration.ofHours(3))),
                new ActiveChat("222", "Bob", FILE_TIME.plus(Duration.ofHours(1))),
                new ActiveChat("333", "Carol", null));

        assertEquals("222", attributor.attribute("IMG-0001.jpg", FILE_TIME, chats));
    }

    @Test
    void chatsOutsideWindowAreIgnored() {
        List<ActiveChat> chats = List.of(new ActiveChat("111", "Alice", FILE_TIME.minus(Duration.ofHours(12))));

        assertEquals(FileRecord.UNKNOWN_SENDER, attributor.attribute("IMG-0001.jpg", FILE_TIME, chats));
        assertEquals(FileRecord.UNKNOWN_SENDER, attributor.attribute("IMG-0001.jpg", null, chats));
    }

    @Test
    void tiesResolveToSmallestIdentityRegardlessOfOrder() {
        ActiveChat later = new ActiveChat("900", "Z", FILE_TIME.plus(Duration.ofHours(2)));
        ActiveChat earlier = new ActiveChat("100", "A", FILE_TIME.minus(Duration.ofHours(2)));

        assertEquals("100", attributor.attribute("IMG-1.jpg", FILE_TIME, List.of(later, earlier)));
        assertEquals("100", attributor.attribute("IMG-1.jpg", FILE_TIME, List.of(earlier, later)));
    }

    @Test
    void folderIdentityOnlyUsesFolderMarkers() {
        assertTrue(attributor.folderIdentity("/m/IMG from +15551234567.jpg").isEmpty());
        assertEquals("123", attributor.folderIdentity("/m/123@s.whatsapp.net/a.jpg").orElseThrow());
        assertTrue(attributor.folderIdentity(null).isEmpty());
    }

    @Test
    void missingNameIsUnknownSender() {
        List<ActiveChat> chats = List.of(new ActiveChat("15550001111", "Dana", FILE_TIME));

        assertEquals(FileRecord.UNKNOWN_SENDER, attributor.attribute(null, FILE_TIME, chats));
        assertEquals(FileRecord.UNKNOWN_SENDER, attributor.attribute("  ", FILE_TIME, chats));
    }
}

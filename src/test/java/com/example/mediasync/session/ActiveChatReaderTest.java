package com.example.mediasync.session;

import com.example.mediasync.scan.ActiveChat;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ActiveChatReaderTest {
    private static final Instant NOW = Instant.parse("2024-03-10T18:30:00Z");
    private final ActiveChatReader reader = new ActiveChatReader(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void readsRowsAndParsesTimes() {
        FakeRenderer renderer = new FakeRenderer().rows(ActiveChatReader.ROW_SELECTOR, List.of(
                new FakeRenderer.FakeElement("row")
                        .child(ActiveChatReader.TITLE_SELECTOR, "+1 555 123 4567")
                        .child(ActiveChatReader.TIME_SELECTOR, "09:15"),
                new FakeRenderer.FakeElement("row")
                        .child(ActiveChatReader.TITLE_SELECTOR, "Family")
                        .child(ActiveChatReader.TIME_SELECTOR, "Yesterday"),
                new FakeRenderer.FakeElement("row").broken(),
                new FakeRenderer.FakeElement("row")
                        .child(ActiveChatReader.TITLE_SELECTOR, "Work")
                        .child(ActiveChatReader.TIME_SELECTOR, "3/8/24")));

        List<ActiveChat> chats = reader.read(renderer);

        assertEquals(3, chats.size());
        assertEquals("15551234567", chats.get(0).identity());
        assertEquals("+1 555 123 4567", chats.get(0).label());
        assertEquals(Instant.parse("2024-03-10T09:15:00Z"), chats.get(0).lastActivity());
        assertEquals("Family", chats.get(1).identity());
        assertEquals(NOW.minus(Duration.ofDays(1)), chats.get(1).lastActivity());
        assertEquals(NOW, chats.get(2).lastActivity());
    }
}

package com.example.mediasync.session;

import com.example.mediasync.scan.ActiveChat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the chat list of an authenticated page.
 */
public final class ActiveChatReader {
    private static final Logger LOGGER = LoggerFactory.getLogger(ActiveChatReader.class);

    static final String ROW_SELECTOR = "div[role='row']";
    static final String TITLE_SELECTOR = "span[data-testid='chat-title']";
    static final String TIME_SELECTOR = "span[data-testid='chat-timestamp']";

    private static final Pattern CLOCK_TIME = Pattern.compile("^\\d{1,2}:\\d{2}$");
    private static final Pattern PHONE = Pattern.compile("\\+[\\d\\s-]+\\d");

    private final Clock clock;

    public ActiveChatReader(Clock clock) {
        this.clock = clock;
    }

    public List<ActiveChat> read(Renderer renderer) {
        List<ActiveChat> chats = new ArrayList<>();
        List<PageElement> rows;
        try {
            rows = renderer.findAll(ROW_SELECTOR);
        } catch (RendererException ex) {
            LOGGER.warn("Unable to read chat list", ex);
            return chats;
        }
        for (PageElement row : rows) {
            try {
                Optional<String> title = row.findChild(TITLE_SELECTOR).map(PageElement::text);
                if (title.isEmpty() || title.get().isBlank()) {
                    continue;
                }
                String time = row.findChild(TIME_SELECTOR).map(PageElement::text).orElse("");
                chats.add(new ActiveChat(identityOf(title.get().trim()), title.get().trim(), lastActivity(time)));
            } catch (RendererException ex) {
                LOGGER.debug("Skipping unreadable chat row", ex);
            }
        }
        LOGGER.info("Read {} active chats", chats.size());
        return chats;
    }

    static String identityOf(String title) {
        Matcher matcher = PHONE.matcher(title);
        if (matcher.find()) {
            return matcher.group().replaceAll("[^\\d]", "");
        }
        return title;
    }

    Instant lastActivity(String text) {
        Instant now = clock.instant();
        String value = text == null ? "" : text.trim();
        if (CLOCK_TIME.matcher(value).matches()) {
            try {
                LocalTime time = LocalTime.parse(value.length() == 4 ? "0" + value : value);
                return LocalDate.now(clock).atTime(time).atZone(clock.getZone()).toInstant();
            } catch (DateTimeParseException ex) {
                return now;
            }
        }
        if ("yesterday".equals(value.toLowerCase(Locale.ROOT))) {
            return now.minus(Duration.ofDays(1));
        }
        return now;
    }
}

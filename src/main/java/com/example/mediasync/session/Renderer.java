package com.example.mediasync.session;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * One live browser page driven on behalf of a session. Every method may throw {@link RendererException}.
 */
public interface Renderer {

    void open(String url);

    /**
     * Waits up to {@code timeout} for the first element matching the CSS selector.
     */
    Optional<PageElement> find(String selector, Duration timeout);

    List<PageElement> findAll(String selector);

    /**
     * Runs a script in the page. Elements passed as arguments are available as {@code arguments[i]}.
     */
    Object execute(String script, Object... args);

    /**
     * Returns a PNG of the visible page.
     */
    byte[] screenshot();

    void refresh();

    String title();

    String pageSource();

    String currentUrl();

    void quit();
}

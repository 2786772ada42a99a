package com.example.mediasync.session;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Scriptable renderer: tests decide which selectors are present and what the page reports.
 */
public class FakeRenderer implements Renderer {
    private final Map<String, PageElement> elements = new HashMap<>();
    private final Set<String> failingSelectors = new HashSet<>();
    private final Map<String, List<PageElement>> collections = new HashMap<>();
    public final List<String> openedUrls = new ArrayList<>();
    public final List<Duration> findTimeouts = new ArrayList<>();
    public String title = "";
    public String pageSource = "";
    public String currentUrl = "";
    public Object scriptResult = "data:image/png;base64,QUJD";
    public boolean scriptFails;
    public boolean failOpen;
    public byte[] screenshot = new byte[] {1, 2, 3};
    public int refreshCount;
    public boolean quit;

    public FakeRenderer show(String selector) {
        elements.put(selector, new FakeElement(selector));
        return this;
    }

    public FakeRenderer hide(String selector) {
        elements.remove(selector);
        return this;
    }

    public FakeRenderer failOn(String selector) {
        failingSelectors.add(selector);
        return this;
    }

    public FakeRenderer rows(String selector, List<PageElement> rows) {
        collections.put(selector, rows);
        return this;
    }

    @Override
    public void open(String url) {
        if (failOpen) {
            throw new RendererException("navigation failed");
        }
        openedUrls.add(url);
    }

    @Override
    public Optional<PageElement> find(String selector, Duration timeout) {
        findTimeouts.add(timeout);
        if (failingSelectors.contains(selector)) {
            throw new RendererException("lookup of " + selector + " failed");
        }
        return Optional.ofNullable(elements.get(selector));
    }

    @Override
    public List<PageElement> findAll(String selector) {
        return collections.getOrDefault(selector, List.of());
    }

    @Override
    public Object execute(String script, Object... args) {
        if (scriptFails) {
            throw new RendererException("script failed");
        }
        return scriptResult;
    }

    @Override
    public byte[] screenshot() {
        return screenshot;
    }

    @Override
    public void refresh() {
        refreshCount++;
    }

    @Override
    public String title() {
        return title;
    }

    @Override
    public String pageSource() {
        return pageSource;
    }

    @Override
    public String currentUrl() {
        return currentUrl;
    }

    @Override
    public void quit() {
        quit = true;
    }

    public static class FakeElement implements PageElement {
        private final String text;
        private final Map<String, PageElement> children = new HashMap<>();
        private boolean broken;

        public FakeElement(String text) {
            this.text = text;
        }

        public FakeElement child(String selector, String childText) {
            children.put(selector, new FakeElement(childText));
            return this;
        }

        public FakeElement broken() {
            this.broken = true;
            return this;
        }

        @Override
        public String text() {
            return text;
        }

        @Override
        public Optional<PageElement> findChild(String selector) {
            if (broken) {
                throw new RendererException("stale element");
            }
            return Optional.ofNullable(children.get(selector));
        }
    }
}

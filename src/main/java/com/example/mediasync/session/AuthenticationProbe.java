package com.example.mediasync.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Decides whether a page shows an authenticated client. Strategies run in order and each one is
 * isolated: a renderer failure inside a strategy counts as no signal from it.
 */
public final class AuthenticationProbe {
    private static final Logger LOGGER = LoggerFactory.getLogger(AuthenticationProbe.class);

    private final SessionConfig config;

    public AuthenticationProbe(SessionConfig config) {
        this.config = config;
    }

    public ProbeOutcome probe(Renderer renderer) {
        for (String landmark : config.landmarkSelectors()) {
            if (present(renderer, landmark)) {
                LOGGER.debug("Landmark {} found; client is authenticated", landmark);
                return ProbeOutcome.AUTHENTICATED;
            }
        }
        if (present(renderer, config.qrSelector())) {
            return ProbeOutcome.QR_VISIBLE;
        }
        if (titleIndicatesReady(renderer)) {
            LOGGER.debug("Page title and content indicate an authenticated client");
            return ProbeOutcome.AUTHENTICATED;
        }
        return ProbeOutcome.NO_SIGNAL;
    }

    private boolean present(Renderer renderer, String selector) {
        try {
            Optional<PageElement> element = renderer.find(selector, config.probeTimeout());
            return element.isPresent();
        } catch (RendererException ex) {
            LOGGER.debug("Probe for {} failed", selector, ex);
            return false;
        }
    }

    private boolean titleIndicatesReady(Renderer renderer) {
        try {
            String title = renderer.title();
            if (title == null || !title.contains(config.titleMarker()) || title.contains(config.loginMarker())) {
                return false;
            }
            String source = renderer.pageSource();
            if (source != null && source.contains(config.readyMarker())) {
                return true;
            }
            String url = renderer.currentUrl();
            return url != null && url.contains(config.acceptUrlMarker());
        } catch (RendererException ex) {
            LOGGER.debug("Title probe failed", ex);
            return false;
        }
    }
}

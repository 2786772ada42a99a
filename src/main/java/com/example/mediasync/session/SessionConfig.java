package com.example.mediasync.session;

import java.time.Duration;
import java.util.List;

/**
 * Selectors, markers and timeouts used to drive the web client.
 */
public record SessionConfig(
        String entryUrl,
        String qrSelector,
        List<String> landmarkSelectors,
        Duration qrTimeout,
        Duration pollQrTimeout,
        Duration probeTimeout,
        String titleMarker,
        String loginMarker,
        String readyMarker,
        String acceptUrlMarker
) {
    public static final String DEFAULT_ENTRY_URL = "https://web.whatsapp.com/";
    public static final String DEFAULT_QR_SELECTOR = "canvas";
    public static final List<String> DEFAULT_LANDMARKS = List.of(
            "[data-icon='chat']",
            "#pane-side",
            "[data-icon='menu']"
    );

    public static SessionConfig defaults() {
        return new SessionConfig(
                DEFAULT_ENTRY_URL,
                DEFAULT_QR_SELECTOR,
                DEFAULT_LANDMARKS,
                Duration.ofSeconds(30),
                Duration.ofSeconds(5),
                Duration.ofSeconds(2),
                "WhatsApp",
                "Login",
                "WhatsApp is ready",
                "/accept"
        );
    }

    public SessionConfig withTimeouts(Duration qr, Duration pollQr, Duration probe) {
        return new SessionConfig(entryUrl, qrSelector, landmarkSelectors, qr, pollQr, probe,
                titleMarker, loginMarker, readyMarker, acceptUrlMarker);
    }
}

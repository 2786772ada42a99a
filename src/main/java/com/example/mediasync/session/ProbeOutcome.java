package com.example.mediasync.session;

public enum ProbeOutcome {
    AUTHENTICATED,
    QR_VISIBLE,
    NO_SIGNAL;

    public boolean isAuthenticated() {
        return this == AUTHENTICATED;
    }
}

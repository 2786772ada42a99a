package com.example.mediasync.session;

import com.example.mediasync.metadata.SessionStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionPollResult(
        String sessionId,
        SessionStatus status,
        boolean authenticated,
        String qrCode
) {
    @JsonProperty("state")
    public String state() {
        return authenticated ? "authenticated" : "not_authenticated";
    }
}

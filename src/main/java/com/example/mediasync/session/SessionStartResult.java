package com.example.mediasync.session;

import com.example.mediasync.OperationError;
import com.example.mediasync.metadata.SessionStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionStartResult(
        String sessionId,
        SessionStatus status,
        boolean alreadyAuthenticated,
        String qrCode,
        OperationError error
) {
}

package com.example.mediasync;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * JSON-shaped failure returned to callers instead of a raw exception.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationError(
        ErrorKind kind,
        String message,
        String affectedId
) {
}

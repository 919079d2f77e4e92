package com.example.gateway.shared.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.OffsetDateTime;

@Data
@AllArgsConstructor
public class ErrorResponse {
    private final OffsetDateTime timestamp;
    private final int status;
    /** Stable error code, e.g. {@code not_connected}. */
    private final String error;
    private final String message;
    private final String path;
}

package com.heronix.callgate.model.dto;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Error body returned by the REST API.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ErrorResponse {

    private Instant timestamp;

    private int status;

    /**
     * Machine-readable reason, e.g. "INTEGRATION_NOT_REGISTERED".
     */
    private String code;

    private String message;

    private String path;
}

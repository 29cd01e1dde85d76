package com.atrium.auth.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;

/**
 * Uniform error body for every non-redirect failure.
 *
 * Messages are generic by construction; the detailed cause is only logged.
 */
@Data
@AllArgsConstructor(staticName = "of")
public class ApiError {
    private Instant timestamp;
    private int status;
    private String error;
    private String message;
    private String path;
}

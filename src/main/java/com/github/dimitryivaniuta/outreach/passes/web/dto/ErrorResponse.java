package com.github.dimitryivaniuta.outreach.passes.web.dto;

import java.time.Instant;

/**
 * Error body for failures that are not reported as a {@code ProblemDetail}.
 *
 * @param code {@code VALIDATION_ERROR}, {@code CONFLICT} or {@code INTERNAL_ERROR}
 * @param message what was rejected, e.g. the first invalid field of an issue-pass request
 * @param timestamp when the error was produced
 */
public record ErrorResponse(String code, String message, Instant timestamp) {

    public static ErrorResponse of(String code, String message) {
        return new ErrorResponse(code, message, Instant.now());
    }
}

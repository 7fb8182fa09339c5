package com.sprintsync.workflow.api.dto;

import java.time.Instant;

/**
 * Error body for every non-2xx response. {@code code} is the lower-case
 * error kind (e.g. "illegal_transition"); {@code retryable} tells the
 * caller whether repeating the same request may succeed.
 */
public record ErrorResponse(
        Instant timestamp,
        int     status,
        String  error,
        String  code,
        boolean retryable,
        String  message,
        String  path
) {}

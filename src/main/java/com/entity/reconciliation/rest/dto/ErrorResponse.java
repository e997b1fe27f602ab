package com.entity.reconciliation.rest.dto;

import java.time.Instant;

/**
 * Error body returned by the REST resource.
 *
 * @param timestamp ISO-8601 instant the error was produced
 */
public record ErrorResponse(
        int status,
        String error,
        String message,
        String path,
        String timestamp
) {
    public ErrorResponse(int status, String error, String message, String path) {
        this(status, error, message, path, Instant.now().toString());
    }

    public static ErrorResponse badRequest(String message, String path) {
        return new ErrorResponse(400, "Bad Request", message, path);
    }

    public static ErrorResponse notFound(String message, String path) {
        return new ErrorResponse(404, "Not Found", message, path);
    }

    public static ErrorResponse unavailable(String message, String path) {
        return new ErrorResponse(503, "Service Unavailable", message, path);
    }

    public static ErrorResponse internalError(String message, String path) {
        return new ErrorResponse(500, "Internal Server Error", message, path);
    }
}

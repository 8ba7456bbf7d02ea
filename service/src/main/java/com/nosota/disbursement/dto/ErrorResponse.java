package com.nosota.disbursement.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;

/**
 * Error body returned by the REST layer.
 *
 * @param status  HTTP status code
 * @param error   Short error title
 * @param message Human readable message
 * @param path    Request path
 * @param details Optional payload (partial result of a pool operation)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        LocalDateTime timestamp,
        int status,
        String error,
        String message,
        String path,
        Object details
) {

    public static ErrorResponse of(int status, String error, String message, String path) {
        return new ErrorResponse(LocalDateTime.now(), status, error, message, path, null);
    }

    public static ErrorResponse of(int status, String error, String message, String path, Object details) {
        return new ErrorResponse(LocalDateTime.now(), status, error, message, path, details);
    }
}

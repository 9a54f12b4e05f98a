package com.bookcatalog.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Body of every non-2xx response from the catalog API.
 *
 * <p>{@code error} is the kind of failure: {@code Validation Error} (422),
 * {@code Not Found} (404), {@code Conflict} (409) or {@code Internal Server Error} (500);
 * protocol errors use the reason phrase of their status. {@code field_errors} is only
 * present for validation errors and names each offending field by its JSON name,
 * e.g. {@code published_year}.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(
    int status,
    String error,
    String message,
    Instant timestamp,
    String path,
    List<FieldError> fieldErrors
) {
    public ErrorResponse(int status, String error, String message,
                         Instant timestamp, String path) {
        this(status, error, message, timestamp, path, List.of());
    }

    /** One rejected field; {@code field} is the snake_case JSON name or the query parameter name. */
    public record FieldError(String field, String message) {}
}

package com.library.bookshelf.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Body of 400 and 415 responses, e.g. {@code {"error": "Missing required fields: title, author"}}.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record InputErrorResponse(
    String error,
    List<String> missingFields
) {
    public InputErrorResponse(String error) {
        this(error, List.of());
    }
}

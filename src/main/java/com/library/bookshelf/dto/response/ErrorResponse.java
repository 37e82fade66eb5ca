package com.library.bookshelf.dto.response;

/**
 * Envelope for 401, 403, 404 and 500 responses.
 */
public record ErrorResponse(
    int code,
    String name,
    String description
) {}

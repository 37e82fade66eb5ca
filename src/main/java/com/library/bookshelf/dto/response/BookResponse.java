package com.library.bookshelf.dto.response;

import java.util.UUID;

public record BookResponse(
    UUID id,
    String title,
    String author,
    String synopsis,
    Links links
) {
    public record Links(String self, String reservations, String reviews) {}
}

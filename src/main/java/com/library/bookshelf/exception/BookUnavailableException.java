package com.library.bookshelf.exception;

import java.util.UUID;

/**
 * The book a reservation was requested for does not exist or has been deleted.
 */
public class BookUnavailableException extends RuntimeException {

    public BookUnavailableException(UUID bookId) {
        super("Book with id " + bookId + " is not available for reservation");
    }
}

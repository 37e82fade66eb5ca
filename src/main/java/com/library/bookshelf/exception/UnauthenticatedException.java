package com.library.bookshelf.exception;

/**
 * Thrown when an operation requires a signed-in user and the request has none.
 * The boundary answers with a redirect to the login endpoint.
 */
public class UnauthenticatedException extends RuntimeException {

    public UnauthenticatedException() {
        super("Authentication required");
    }
}

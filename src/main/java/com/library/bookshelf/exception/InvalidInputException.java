package com.library.bookshelf.exception;

import java.util.List;

/**
 * Malformed or incomplete request data. {@link #getMissingFields()} lists every required
 * field that was absent, in the order the fields are checked.
 */
public class InvalidInputException extends RuntimeException {

    private final List<String> missingFields;

    public InvalidInputException(String message) {
        super(message);
        this.missingFields = List.of();
    }

    private InvalidInputException(String message, List<String> missingFields) {
        super(message);
        this.missingFields = List.copyOf(missingFields);
    }

    public static InvalidInputException missingFields(List<String> fields) {
        return new InvalidInputException("Missing required fields: " + String.join(", ", fields), fields);
    }

    public List<String> getMissingFields() {
        return missingFields;
    }
}

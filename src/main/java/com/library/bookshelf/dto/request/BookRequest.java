package com.library.bookshelf.dto.request;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of book create and update requests. All three fields are required; updates
 * replace all of them.
 */
public record BookRequest(
    String title,
    String synopsis,
    String author
) {

    /** Names of absent fields, in the order title, synopsis, author. */
    public List<String> missingFields() {
        List<String> missing = new ArrayList<>();
        if (title == null) {
            missing.add("title");
        }
        if (synopsis == null) {
            missing.add("synopsis");
        }
        if (author == null) {
            missing.add("author");
        }
        return missing;
    }
}

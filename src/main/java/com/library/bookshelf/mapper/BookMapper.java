package com.library.bookshelf.mapper;

import com.library.bookshelf.dto.response.BookResponse;
import com.library.bookshelf.entity.Book;
import com.library.bookshelf.entity.BookLinks;
import org.springframework.web.util.UriComponentsBuilder;

public final class BookMapper {

    private BookMapper() {}

    /**
     * Projects a book for the response, resolving its stored link paths against
     * {@code baseUrl} (scheme, host and context path of the current request).
     */
    public static BookResponse toResponse(Book book, String baseUrl) {
        BookLinks links = book.getLinks();
        return new BookResponse(
            book.getId(),
            book.getTitle(),
            book.getAuthor(),
            book.getSynopsis(),
            new BookResponse.Links(
                absolute(baseUrl, links.getSelf()),
                absolute(baseUrl, links.getReservations()),
                absolute(baseUrl, links.getReviews())
            )
        );
    }

    static String absolute(String baseUrl, String path) {
        return UriComponentsBuilder.fromHttpUrl(baseUrl).path(path).build().toUriString();
    }
}

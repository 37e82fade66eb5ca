package com.library.bookshelf.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Relative link paths stored with a {@link Book}. They are joined with the request's
 * scheme and host only when a response is rendered.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BookLinks {

    @Column(name = "self_link", nullable = false)
    private String self;

    @Column(name = "reservations_link", nullable = false)
    private String reservations;

    @Column(name = "reviews_link", nullable = false)
    private String reviews;

    private BookLinks(String self, String reservations, String reviews) {
        this.self = self;
        this.reservations = reservations;
        this.reviews = reviews;
    }

    public static BookLinks forBook(UUID bookId) {
        String self = "/books/" + bookId;
        return new BookLinks(self, self + "/reservations", self + "/reviews");
    }
}

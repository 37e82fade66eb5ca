package com.library.bookshelf.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

/**
 * JPA entity representing a catalogue book.
 *
 * <p>The {@link #id} is assigned by {@code BookService} when the book is created and is
 * never regenerated. {@link #links} always derive from that id.
 *
 * <p><strong>Soft delete</strong>: deleting a book flips {@link #state} to
 * {@link BookState#DELETED} through a conditional bulk update in {@code BookRepository}.
 * Rows are never removed, and the state never returns to {@link BookState#ACTIVE}.
 */
@Entity
@Table(name = "books")
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EqualsAndHashCode(of = "id", callSuper = false)
public class Book extends BaseEntity {

    @Id
    private UUID id;

    @Column(name = "title", nullable = false, columnDefinition = "TEXT")
    private String title;

    @Column(name = "author", nullable = false, columnDefinition = "TEXT")
    private String author;

    @Column(name = "synopsis", nullable = false, columnDefinition = "TEXT")
    private String synopsis;

    @Embedded
    private BookLinks links;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 20)
    private BookState state = BookState.ACTIVE;

    public Book(UUID id) {
        this.id = id;
        this.links = BookLinks.forBook(id);
    }

    public boolean isActive() {
        return state == BookState.ACTIVE;
    }
}

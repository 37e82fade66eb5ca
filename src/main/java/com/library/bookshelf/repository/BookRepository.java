package com.library.bookshelf.repository;

import com.library.bookshelf.entity.Book;
import com.library.bookshelf.entity.BookState;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Store adapter for books.
 *
 * <p>State transitions are single conditional {@code UPDATE} statements matching on the
 * id <em>and</em> {@code state = ACTIVE}. Of two concurrent attempts on the same book only
 * one matches a row; the other gets {@code 0} back and reports the book as not found.
 */
public interface BookRepository extends JpaRepository<Book, UUID> {

    Optional<Book> findByIdAndState(UUID id, BookState state);

    List<Book> findAllByState(BookState state, Pageable pageable);

    long countByState(BookState state);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Book b SET b.title = :title, b.author = :author, b.synopsis = :synopsis, "
        + "b.links.self = :selfLink, b.links.reservations = :reservationsLink, "
        + "b.links.reviews = :reviewsLink, b.updatedAt = :now "
        + "WHERE b.id = :id AND b.state = com.library.bookshelf.entity.BookState.ACTIVE")
    int updateActive(@Param("id") UUID id,
                     @Param("title") String title,
                     @Param("author") String author,
                     @Param("synopsis") String synopsis,
                     @Param("selfLink") String selfLink,
                     @Param("reservationsLink") String reservationsLink,
                     @Param("reviewsLink") String reviewsLink,
                     @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Book b SET b.state = com.library.bookshelf.entity.BookState.DELETED, b.updatedAt = :now "
        + "WHERE b.id = :id AND b.state = com.library.bookshelf.entity.BookState.ACTIVE")
    int softDelete(@Param("id") UUID id, @Param("now") Instant now);
}

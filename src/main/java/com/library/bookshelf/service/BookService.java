package com.library.bookshelf.service;

import com.library.bookshelf.config.BookshelfProperties;
import com.library.bookshelf.dto.request.BookRequest;
import com.library.bookshelf.dto.response.PagedResponse;
import com.library.bookshelf.entity.Book;
import com.library.bookshelf.entity.BookLinks;
import com.library.bookshelf.entity.BookState;
import com.library.bookshelf.exception.InvalidInputException;
import com.library.bookshelf.exception.ResourceNotFoundException;
import com.library.bookshelf.repository.BookRepository;
import com.library.bookshelf.repository.OffsetPageRequest;
import com.library.bookshelf.security.UserPrincipal;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class BookService {

    private static final Logger log = LoggerFactory.getLogger(BookService.class);

    private static final Sort LISTING_ORDER = Sort.by("createdAt", "id");

    private final BookRepository bookRepository;
    private final BookshelfProperties properties;

    @Transactional(readOnly = true)
    public PagedResponse<Book> findAll(Integer offset, Integer limit) {
        int effectiveOffset = offset == null ? 0 : offset;
        int effectiveLimit = limit == null ? properties.defaultPageLimit() : limit;
        if (effectiveOffset < 0) {
            throw new InvalidInputException("offset must be a non-negative integer");
        }
        if (effectiveLimit < 0) {
            throw new InvalidInputException("limit must be a non-negative integer");
        }

        long total = bookRepository.countByState(BookState.ACTIVE);
        List<Book> items = effectiveLimit == 0
            ? List.of()
            : bookRepository.findAllByState(BookState.ACTIVE,
                new OffsetPageRequest(effectiveOffset, effectiveLimit, LISTING_ORDER));
        return new PagedResponse<>(total, effectiveOffset, effectiveLimit, items);
    }

    @Transactional(readOnly = true)
    public Book findById(UUID id) {
        return bookRepository.findByIdAndState(id, BookState.ACTIVE)
            .orElseThrow(() -> new ResourceNotFoundException("Book", id));
    }

    @Transactional
    public Book create(BookRequest request) {
        requireAllFields(request);

        Book book = new Book(UUID.randomUUID());
        book.setTitle(request.title());
        book.setSynopsis(request.synopsis());
        book.setAuthor(request.author());
        Book saved = bookRepository.save(book);
        log.info("Created book {}", saved.getId());
        return saved;
    }

    @Transactional
    public Book update(UUID id, BookRequest request) {
        requireAllFields(request);

        BookLinks links = BookLinks.forBook(id);
        int updated = bookRepository.updateActive(id, request.title(), request.author(), request.synopsis(),
            links.getSelf(), links.getReservations(), links.getReviews(), Instant.now());
        if (updated == 0) {
            throw new ResourceNotFoundException("Book", id);
        }
        return bookRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Book", id));
    }

    @Transactional
    public void delete(UUID id, UserPrincipal actor) {
        if (bookRepository.softDelete(id, Instant.now()) == 0) {
            throw new ResourceNotFoundException("Book", id);
        }
        log.info("User '{}' deleted book '{}'", actor.email(), id);
    }

    private static void requireAllFields(BookRequest request) {
        if (request == null) {
            throw InvalidInputException.missingFields(List.of("title", "synopsis", "author"));
        }
        List<String> missing = request.missingFields();
        if (!missing.isEmpty()) {
            throw InvalidInputException.missingFields(missing);
        }
    }
}

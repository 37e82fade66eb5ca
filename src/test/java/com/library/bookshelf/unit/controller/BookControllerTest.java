package com.library.bookshelf.unit.controller;

import com.library.bookshelf.controller.BookController;
import com.library.bookshelf.dto.request.BookRequest;
import com.library.bookshelf.dto.response.PagedResponse;
import com.library.bookshelf.entity.Book;
import com.library.bookshelf.exception.InvalidInputException;
import com.library.bookshelf.exception.ResourceNotFoundException;
import com.library.bookshelf.security.IdentityResolver;
import com.library.bookshelf.security.Roles;
import com.library.bookshelf.security.UserPrincipal;
import com.library.bookshelf.service.BookService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockHttpSession;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class BookControllerTest {

    private static final UUID BOOK_ID = UUID.fromString("0b6f3c55-8a2e-4d7c-9f41-2c9e5a7d1e10");

    @Mock
    private BookService bookService;

    @Mock
    private IdentityResolver identityResolver;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = ControllerTestSupport.mockMvc(new BookController(bookService), identityResolver);
    }

    @Test
    void list_anonymous_returnsWindowWithAbsoluteLinks() throws Exception {
        when(bookService.findAll(null, null)).thenReturn(new PagedResponse<>(1, 0, 20, List.of(book())));

        mockMvc.perform(get("/books"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_count").value(1))
            .andExpect(jsonPath("$.offset").value(0))
            .andExpect(jsonPath("$.limit").value(20))
            .andExpect(jsonPath("$.items[0].id").value(BOOK_ID.toString()))
            .andExpect(jsonPath("$.items[0].title").value("Dune"))
            .andExpect(jsonPath("$.items[0].links.self").value("http://localhost/books/" + BOOK_ID))
            .andExpect(jsonPath("$.items[0].links.reservations")
                .value("http://localhost/books/" + BOOK_ID + "/reservations"))
            .andExpect(jsonPath("$.items[0].links.reviews")
                .value("http://localhost/books/" + BOOK_ID + "/reviews"));
    }

    @Test
    void list_passesOffsetAndLimitThrough() throws Exception {
        when(bookService.findAll(5, 0)).thenReturn(new PagedResponse<>(7, 5, 0, List.of()));

        mockMvc.perform(get("/books").param("offset", "5").param("limit", "0"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_count").value(7))
            .andExpect(jsonPath("$.items").isEmpty());
    }

    @Test
    void list_negativeLimit_returns400() throws Exception {
        when(bookService.findAll(null, -1))
            .thenThrow(new InvalidInputException("limit must be a non-negative integer"));

        mockMvc.perform(get("/books").param("limit", "-1"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("limit must be a non-negative integer"))
            .andExpect(jsonPath("$.missing_fields").doesNotExist());
    }

    @Test
    void list_nonNumericOffset_returns400() throws Exception {
        mockMvc.perform(get("/books").param("offset", "abc"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").exists());

        verifyNoInteractions(bookService);
    }

    @Test
    void get_unknownBook_returns404() throws Exception {
        when(bookService.findById(BOOK_ID)).thenThrow(new ResourceNotFoundException("Book", BOOK_ID));

        mockMvc.perform(get("/books/{id}", BOOK_ID))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value(404))
            .andExpect(jsonPath("$.name").value("Not Found"));
    }

    @Test
    void get_malformedId_returns404() throws Exception {
        mockMvc.perform(get("/books/{id}", "not-a-uuid"))
            .andExpect(status().isNotFound());

        verifyNoInteractions(bookService);
    }

    @Test
    void create_anonymous_redirectsToLogin() throws Exception {
        mockMvc.perform(post("/books")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"Dune\",\"synopsis\":\"Spice\",\"author\":\"Herbert\"}"))
            .andExpect(status().isFound())
            .andExpect(header().string("Location", "/auth/login"));

        verifyNoInteractions(bookService);
    }

    @Test
    void create_viewer_isForbiddenBeforeBodyIsRead() throws Exception {
        MockHttpSession session = ControllerTestSupport.signedIn(identityResolver, 4L, Roles.VIEWER);

        mockMvc.perform(post("/books").session(session)
                .contentType(MediaType.TEXT_PLAIN)
                .content("not json"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.code").value(403))
            .andExpect(jsonPath("$.name").value("Forbidden"));

        verifyNoInteractions(bookService);
    }

    @Test
    void create_editor_returns201() throws Exception {
        MockHttpSession session = ControllerTestSupport.signedIn(identityResolver, 2L, Roles.EDITOR);
        when(bookService.create(new BookRequest("Dune", "Spice", "Herbert"))).thenReturn(book());

        mockMvc.perform(post("/books").session(session)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"Dune\",\"synopsis\":\"Spice\",\"author\":\"Herbert\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").value(BOOK_ID.toString()))
            .andExpect(jsonPath("$.author").value("Herbert"));
    }

    @Test
    void create_missingFields_returns400WithFieldList() throws Exception {
        MockHttpSession session = ControllerTestSupport.signedIn(identityResolver, 2L, Roles.EDITOR);
        when(bookService.create(new BookRequest(null, null, "X")))
            .thenThrow(InvalidInputException.missingFields(List.of("title", "synopsis")));

        mockMvc.perform(post("/books").session(session)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"author\":\"X\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Missing required fields: title, synopsis"))
            .andExpect(jsonPath("$.missing_fields[0]").value("title"))
            .andExpect(jsonPath("$.missing_fields[1]").value("synopsis"));
    }

    @Test
    void create_nonJsonBody_returns415() throws Exception {
        MockHttpSession session = ControllerTestSupport.signedIn(identityResolver, 2L, Roles.ADMIN);

        mockMvc.perform(post("/books").session(session)
                .contentType(MediaType.TEXT_PLAIN)
                .content("title=Dune"))
            .andExpect(status().isUnsupportedMediaType())
            .andExpect(jsonPath("$.error").value("Request must be JSON"));

        verify(bookService, never()).create(any());
    }

    @Test
    void create_nonStringField_returns400() throws Exception {
        MockHttpSession session = ControllerTestSupport.signedIn(identityResolver, 2L, Roles.EDITOR);

        mockMvc.perform(post("/books").session(session)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":123,\"synopsis\":true,\"author\":\"a\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").exists());

        verify(bookService, never()).create(any());
    }

    @Test
    void create_malformedJson_returns400() throws Exception {
        MockHttpSession session = ControllerTestSupport.signedIn(identityResolver, 2L, Roles.ADMIN);

        mockMvc.perform(post("/books").session(session)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":"))
            .andExpect(status().isBadRequest());

        verify(bookService, never()).create(any());
    }

    @Test
    void update_editor_returnsUpdatedBook() throws Exception {
        MockHttpSession session = ControllerTestSupport.signedIn(identityResolver, 2L, Roles.EDITOR);
        Book updated = book();
        updated.setTitle("Dune Messiah");
        when(bookService.update(eq(BOOK_ID), any(BookRequest.class))).thenReturn(updated);

        mockMvc.perform(put("/books/{id}", BOOK_ID).session(session)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"Dune Messiah\",\"synopsis\":\"Spice\",\"author\":\"Herbert\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.title").value("Dune Messiah"));
    }

    @Test
    void delete_editor_isForbidden() throws Exception {
        MockHttpSession session = ControllerTestSupport.signedIn(identityResolver, 2L, Roles.EDITOR);

        mockMvc.perform(delete("/books/{id}", BOOK_ID).session(session))
            .andExpect(status().isForbidden());

        verifyNoInteractions(bookService);
    }

    @Test
    void delete_admin_returns204() throws Exception {
        MockHttpSession session = ControllerTestSupport.signedIn(identityResolver, 1L, Roles.ADMIN);

        mockMvc.perform(delete("/books/{id}", BOOK_ID).session(session))
            .andExpect(status().isNoContent());

        verify(bookService).delete(eq(BOOK_ID), any(UserPrincipal.class));
    }

    @Test
    void storageFailure_returns500() throws Exception {
        when(bookService.findById(BOOK_ID)).thenThrow(new DataAccessResourceFailureException("connection refused"));

        mockMvc.perform(get("/books/{id}", BOOK_ID))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.code").value(500))
            .andExpect(jsonPath("$.description").value("Storage unavailable"));
    }

    private static Book book() {
        Book book = new Book(BOOK_ID);
        book.setTitle("Dune");
        book.setSynopsis("Spice");
        book.setAuthor("Herbert");
        return book;
    }
}

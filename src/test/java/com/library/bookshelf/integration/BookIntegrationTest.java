package com.library.bookshelf.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.library.bookshelf.security.Roles;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockHttpSession;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class BookIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    private ObjectMapper objectMapper;

    private MockHttpSession admin;
    private MockHttpSession editor;
    private MockHttpSession viewer;

    @BeforeEach
    void setUpUsers() {
        admin = sessionFor(createUser("sub-admin", "admin@example.com", "Ada", "Admin", Roles.ADMIN));
        editor = sessionFor(createUser("sub-editor", "editor@example.com", "Eddie", "Editor", Roles.EDITOR));
        viewer = sessionFor(createUser("sub-viewer", "viewer@example.com", "Vic", "Viewer", Roles.VIEWER));
    }

    @Test
    void fullLifecycle_createReadUpdateDelete() throws Exception {
        String id = createBook(editor, "Dune", "Spice and sandworms", "Frank Herbert");

        mockMvc.perform(get("/books/{id}", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.title").value("Dune"))
            .andExpect(jsonPath("$.links.self").value("http://localhost/books/" + id))
            .andExpect(jsonPath("$.links.reservations").value("http://localhost/books/" + id + "/reservations"))
            .andExpect(jsonPath("$.links.reviews").value("http://localhost/books/" + id + "/reviews"));

        mockMvc.perform(put("/books/{id}", id).session(editor)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("Dune Messiah", "The sequel", "Frank Herbert")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value(id))
            .andExpect(jsonPath("$.title").value("Dune Messiah"))
            .andExpect(jsonPath("$.synopsis").value("The sequel"));

        mockMvc.perform(delete("/books/{id}", id).session(admin))
            .andExpect(status().isNoContent());

        mockMvc.perform(get("/books/{id}", id))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value(404));

        mockMvc.perform(delete("/books/{id}", id).session(admin))
            .andExpect(status().isNotFound());

        mockMvc.perform(put("/books/{id}", id).session(editor)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("Again", "Again", "Again")))
            .andExpect(status().isNotFound());

        String state = jdbcTemplate.queryForObject(
            "SELECT state FROM books WHERE id = CAST(? AS uuid)", String.class, id);
        assertThat(state).isEqualTo("DELETED");
    }

    @Test
    void list_excludesDeletedBooksAndHonoursWindow() throws Exception {
        String first = createBook(editor, "One", "s", "a");
        createBook(editor, "Two", "s", "a");
        createBook(editor, "Three", "s", "a");
        mockMvc.perform(delete("/books/{id}", first).session(admin)).andExpect(status().isNoContent());

        mockMvc.perform(get("/books"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_count").value(2))
            .andExpect(jsonPath("$.offset").value(0))
            .andExpect(jsonPath("$.limit").value(20))
            .andExpect(jsonPath("$.items.length()").value(2))
            .andExpect(jsonPath("$.items[0].title").value("Two"));

        mockMvc.perform(get("/books").param("offset", "1").param("limit", "1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_count").value(2))
            .andExpect(jsonPath("$.items.length()").value(1))
            .andExpect(jsonPath("$.items[0].title").value("Three"));

        mockMvc.perform(get("/books").param("limit", "0"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_count").value(2))
            .andExpect(jsonPath("$.items").isEmpty());

        mockMvc.perform(get("/books").param("offset", "-1"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void create_requiresEditorOrAdmin() throws Exception {
        mockMvc.perform(post("/books")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("Dune", "s", "a")))
            .andExpect(status().isFound())
            .andExpect(header().string("Location", "/auth/login"));

        mockMvc.perform(post("/books").session(viewer)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("Dune", "s", "a")))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.name").value("Forbidden"));

        mockMvc.perform(delete("/books/{id}", createBook(admin, "Dune", "s", "a")).session(editor))
            .andExpect(status().isForbidden());
    }

    @Test
    void create_reportsEveryMissingField() throws Exception {
        mockMvc.perform(post("/books").session(editor)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"author\":\"X\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Missing required fields: title, synopsis"))
            .andExpect(jsonPath("$.missing_fields.length()").value(2));

        mockMvc.perform(post("/books").session(editor)
                .contentType(MediaType.TEXT_PLAIN)
                .content("Dune"))
            .andExpect(status().isUnsupportedMediaType());

        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM books", Integer.class);
        assertThat(count).isZero();
    }

    @Test
    void create_nonStringField_returns400AndStoresNothing() throws Exception {
        mockMvc.perform(post("/books").session(editor)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":123,\"synopsis\":true,\"author\":\"a\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").exists());

        mockMvc.perform(post("/books").session(editor)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"Dune\",\"synopsis\":1.5,\"author\":\"a\"}"))
            .andExpect(status().isBadRequest());

        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM books", Integer.class);
        assertThat(count).isZero();
    }

    @Test
    void staleSession_isTreatedAsLoggedOut() throws Exception {
        MockHttpSession stale = new MockHttpSession();
        stale.setAttribute("user_id", 9999L);

        mockMvc.perform(post("/books").session(stale)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("Dune", "s", "a")))
            .andExpect(status().isFound())
            .andExpect(header().string("Location", "/auth/login"));

        assertThat(stale.isInvalid()).isTrue();
    }

    private String createBook(MockHttpSession session, String title, String synopsis, String author)
            throws Exception {
        String response = mockMvc.perform(post("/books").session(session)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body(title, synopsis, author)))
            .andExpect(status().isCreated())
            .andReturn().getResponse().getContentAsString();
        JsonNode json = objectMapper.readTree(response);
        return json.get("id").asText();
    }

    private String body(String title, String synopsis, String author) throws Exception {
        return objectMapper.writeValueAsString(Map.of("title", title, "synopsis", synopsis, "author", author));
    }
}

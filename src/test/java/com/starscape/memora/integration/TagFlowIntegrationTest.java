package com.starscape.memora.integration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.*;

/**
 * Tag management: seeded defaults, normalization, usage counts and deletion.
 */
public class TagFlowIntegrationTest extends BaseIntegrationTest {
    
    private String token;
    
    @BeforeEach
    void setUp() {
        token = registerUser();
    }
    
    @Test
    void shouldSeedDefaultTagsOnRegistration() {
        as(token)
                .get("/tags")
                .then()
                .statusCode(200)
                .body("data.name", containsInAnyOrder("work", "personal", "reading", "travel", "food", "tech", "finance"))
                .body("data.bookmarkCount", everyItem(equalTo(0)));
    }
    
    @Test
    void shouldNormalizeAndRejectExistingNames() {
        String id = as(token)
                .body(Map.of("name", "  Side Project "))
                .post("/tags")
                .then()
                .statusCode(201)
                .body("data.name", equalTo("side project"))
                .extract()
                .path("data.id");
        
        as(token)
                .body(Map.of("name", "WORK"))
                .post("/tags")
                .then()
                .statusCode(409);
        
        as(token)
                .body(Map.of("name", "Hobby"))
                .put("/tags/" + id)
                .then()
                .statusCode(200)
                .body("data.name", equalTo("hobby"));
        
        as(token)
                .body(Map.of("name", "Travel"))
                .put("/tags/" + id)
                .then()
                .statusCode(409);
    }
    
    @Test
    void shouldShowTaggedBookmarksAndDetachOnDelete() {
        String bookmarkId = createBookmark(token, "https://example.com/tagged");
        String tagId = as(token)
                .body(Map.of("tags", List.of(Map.of("name", "research"))))
                .put("/bookmarks/" + bookmarkId)
                .then()
                .statusCode(200)
                .extract()
                .path("data.tags[0].id");
        
        as(token)
                .get("/tags/" + tagId)
                .then()
                .statusCode(200)
                .body("data.name", equalTo("research"))
                .body("data.bookmarks.id", contains(bookmarkId));
        
        as(token)
                .get("/tags")
                .then()
                .body("data.find { it.name == 'research' }.bookmarkCount", equalTo(1));
        
        as(token)
                .delete("/tags/" + tagId)
                .then()
                .statusCode(200);
        
        as(token)
                .get("/bookmarks/" + bookmarkId)
                .then()
                .statusCode(200)
                .body("data.tags", empty());
        as(token)
                .get("/tags/" + tagId)
                .then()
                .statusCode(404);
    }
    
    @Test
    void shouldKeepOtherTagsWhenDeletingOne() {
        String both = createBookmark(token, "https://example.com/both-tags");
        String onlyKept = createBookmark(token, "https://example.com/kept-tag-only");
        
        String doomedId = as(token)
                .body(Map.of("tags", List.of(Map.of("name", "doomed"), Map.of("name", "kept"))))
                .put("/bookmarks/" + both)
                .then()
                .statusCode(200)
                .body("data.tags.name", containsInAnyOrder("doomed", "kept"))
                .extract()
                .path("data.tags.find { it.name == 'doomed' }.id");
        String keptId = as(token)
                .body(Map.of("tags", List.of(Map.of("name", "kept"))))
                .put("/bookmarks/" + onlyKept)
                .then()
                .statusCode(200)
                .extract()
                .path("data.tags[0].id");
        
        as(token)
                .delete("/tags/" + doomedId)
                .then()
                .statusCode(200);
        
        as(token)
                .get("/bookmarks/" + both)
                .then()
                .statusCode(200)
                .body("data.tags.id", contains(keptId));
        as(token)
                .get("/bookmarks/" + onlyKept)
                .then()
                .statusCode(200)
                .body("data.tags.id", contains(keptId));
        as(token)
                .get("/tags/" + keptId)
                .then()
                .statusCode(200)
                .body("data.bookmarks.id", containsInAnyOrder(both, onlyKept));
        as(token)
                .get("/tags")
                .then()
                .body("data.name", not(hasItem("doomed")))
                .body("data.find { it.name == 'kept' }.bookmarkCount", equalTo(2));
    }
    
    @Test
    void shouldNotExposeOtherUsersTags() {
        String tagId = as(token)
                .body(Map.of("name", "secret"))
                .post("/tags")
                .then()
                .statusCode(201)
                .extract()
                .path("data.id");
        String other = registerUser();
        
        as(other).get("/tags/" + tagId).then().statusCode(404);
        as(other).delete("/tags/" + tagId).then().statusCode(404);
        as(token).get("/tags/" + tagId).then().statusCode(200);
    }
}

package com.starscape.memora.integration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.*;

/**
 * Bookmark lifecycle: creation with metadata and seeded links, editing, listing and deletion.
 */
public class BookmarkFlowIntegrationTest extends BaseIntegrationTest {
    
    private String token;
    
    @BeforeEach
    void setUp() {
        token = registerUser();
    }
    
    @Test
    void shouldCreateFirstBookmarkInSystemCollection() {
        String systemId = systemCollectionId(token);
        
        as(token)
                .body(Map.of("url", "https://example.com/article"))
                .post("/bookmarks")
                .then()
                .statusCode(201)
                .body("data.url", equalTo("https://example.com/article"))
                .body("data.title", equalTo("Page example.com/article"))
                .body("data.description", equalTo("About example.com/article"))
                .body("data.imageUrl", equalTo("https://cdn.example.com/preview.png"))
                .body("data.tags", empty())
                .body("data.collections.id", contains(systemId));
    }
    
    @Test
    void shouldFallBackToUrlWhenNoMetadata() {
        String url = "https://example.com/no-metadata/" + "a".repeat(120);
        
        as(token)
                .body(Map.of("url", url))
                .post("/bookmarks")
                .then()
                .statusCode(201)
                .body("data.title", equalTo(url.substring(0, 100)))
                .body("data.description", nullValue());
    }
    
    @Test
    void shouldRejectMissingOrNonStringUrl() {
        as(token)
                .body(Map.of())
                .post("/bookmarks")
                .then()
                .statusCode(400)
                .body("errors[0].field", equalTo("url"));
        
        as(token)
                .body(Map.of("url", 42))
                .post("/bookmarks")
                .then()
                .statusCode(400)
                .body("errors[0].field", equalTo("url"));
    }
    
    @Test
    void shouldRejectDuplicateUrlPerUserOnly() {
        createBookmark(token, "https://example.com/dup");
        
        as(token)
                .body(Map.of("url", "https://example.com/dup"))
                .post("/bookmarks")
                .then()
                .statusCode(409)
                .body("errors[0].field", equalTo("url"));
        
        String other = registerUser();
        createBookmark(other, "https://example.com/dup");
    }
    
    @Test
    void shouldSeedNewBookmarkFromMostRecentOne() {
        String reading = createCollection(token, "Reading");
        String first = createBookmark(token, "https://example.com/first");
        
        as(token)
                .body(Map.of(
                    "tags", List.of(Map.of("name", "Work")),
                    "collections", List.of(Map.of("id", reading))))
                .put("/bookmarks/" + first)
                .then()
                .statusCode(200);
        
        as(token)
                .body(Map.of("url", "https://example.com/second"))
                .post("/bookmarks")
                .then()
                .statusCode(201)
                .body("data.tags.name", contains("work"))
                .body("data.collections.id", contains(reading));
    }
    
    @Test
    void shouldNormalizeTagNamesOnUpdate() {
        String id = createBookmark(token, "https://example.com/tags");
        
        as(token)
                .body(Map.of("tags", List.of(Map.of("name", "Work "), Map.of("name", " work"), Map.of("name", "Side Project"))))
                .put("/bookmarks/" + id)
                .then()
                .statusCode(200)
                .body("data.tags.name", containsInAnyOrder("work", "side project"));
        
        // Seeded "Work" was reused rather than duplicated
        as(token)
                .get("/tags")
                .then()
                .body("data.findAll { it.name == 'work' }", hasSize(1));
    }
    
    @Test
    void shouldDistinguishOmittedAndEmptyTagLists() {
        String id = createBookmark(token, "https://example.com/lists");
        as(token)
                .body(Map.of("tags", List.of(Map.of("name", "tech"))))
                .put("/bookmarks/" + id)
                .then()
                .statusCode(200);
        
        as(token)
                .body(Map.of("title", "Renamed"))
                .put("/bookmarks/" + id)
                .then()
                .statusCode(200)
                .body("data.title", equalTo("Renamed"))
                .body("data.tags.name", contains("tech"));
        
        as(token)
                .body(Map.of("tags", List.of()))
                .put("/bookmarks/" + id)
                .then()
                .statusCode(200)
                .body("data.tags", empty())
                .body("data.title", equalTo("Renamed"));
    }
    
    @Test
    void shouldIgnoreCollectionsOwnedByOthers() {
        String other = registerUser();
        String foreign = createCollection(other, "Theirs");
        String mine = createCollection(token, "Mine");
        String id = createBookmark(token, "https://example.com/owned");
        
        as(token)
                .body(Map.of("collections", List.of(Map.of("id", foreign), Map.of("id", mine))))
                .put("/bookmarks/" + id)
                .then()
                .statusCode(200)
                .body("data.collections.id", contains(mine));
    }
    
    @Test
    void shouldHideOtherUsersBookmarks() {
        String id = createBookmark(token, "https://example.com/private");
        String other = registerUser();
        
        as(other).get("/bookmarks/" + id).then().statusCode(404);
        as(other).body(Map.of("title", "x")).put("/bookmarks/" + id).then().statusCode(404);
        as(other).delete("/bookmarks/" + id).then().statusCode(404);
        as(token).get("/bookmarks/" + id).then().statusCode(200);
    }
    
    @Test
    void shouldPageSearchAndCount() {
        createBookmark(token, "https://example.com/alpha");
        createBookmark(token, "https://example.com/beta");
        createBookmark(token, "https://example.com/gamma");
        
        as(token)
                .get("/bookmarks/count")
                .then()
                .statusCode(200)
                .body("data.count", equalTo(3));
        
        as(token)
                .queryParam("page", 1)
                .queryParam("pageSize", 2)
                .get("/bookmarks")
                .then()
                .statusCode(200)
                .body("data", hasSize(2))
                .body("data[0].url", equalTo("https://example.com/gamma"))
                .body("metadata.totalCount", equalTo(3))
                .body("metadata.totalPages", equalTo(2))
                .body("metadata.hasNextPage", equalTo(true))
                .body("metadata.nextPage", equalTo(2));
        
        as(token)
                .queryParam("page", 2)
                .queryParam("pageSize", 2)
                .get("/bookmarks")
                .then()
                .body("data", hasSize(1))
                .body("metadata.hasPreviousPage", equalTo(true))
                .body("metadata.nextPage", nullValue());
        
        as(token)
                .queryParam("search", "BETA")
                .get("/bookmarks")
                .then()
                .body("data.url", contains("https://example.com/beta"));
        
        as(token)
                .queryParam("pageSize", 0)
                .get("/bookmarks")
                .then()
                .statusCode(400);
    }
    
    @Test
    void shouldFilterByTagAndCollection() {
        String reading = createCollection(token, "Reading");
        String tagged = createBookmark(token, "https://example.com/tagged");
        createBookmark(token, "https://example.com/plain");
        
        String tagId = as(token)
                .body(Map.of("tags", List.of(Map.of("name", "finance")), "collections", List.of(Map.of("id", reading))))
                .put("/bookmarks/" + tagged)
                .then()
                .statusCode(200)
                .extract()
                .path("data.tags[0].id");
        
        as(token)
                .queryParam("tagId", tagId)
                .get("/bookmarks")
                .then()
                .body("data.id", contains(tagged));
        
        as(token)
                .queryParam("collectionId", reading)
                .get("/bookmarks")
                .then()
                .body("data.id", hasItem(tagged));
    }
    
    @Test
    void shouldDeleteBookmark() {
        String id = createBookmark(token, "https://example.com/gone");
        
        as(token).delete("/bookmarks/" + id).then().statusCode(200);
        as(token).get("/bookmarks/" + id).then().statusCode(404);
        as(token).get("/bookmarks/count").then().body("data.count", equalTo(0));
    }
}

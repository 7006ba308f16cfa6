package com.starscape.memora.features.bookmarks.infra;

import com.starscape.memora.features.bookmarks.domain.Bookmark;
import com.starscape.memora.features.collections.domain.BookmarkCollection;
import com.starscape.memora.features.tags.domain.BookmarkTag;
import jakarta.persistence.criteria.Subquery;
import org.springframework.data.jpa.domain.Specification;

import java.util.Locale;

/**
 * Composable filters for bookmark listing.
 */
public final class BookmarkSpecifications {
    
    private BookmarkSpecifications() {
    }
    
    public static Specification<Bookmark> ownedBy(String userId) {
        return (root, query, cb) -> cb.equal(root.get("userId"), userId);
    }
    
    /**
     * Case-insensitive substring match on title, url or description.
     */
    public static Specification<Bookmark> matches(String search) {
        String pattern = "%" + escapeLike(search.trim().toLowerCase(Locale.ROOT)) + "%";
        return (root, query, cb) -> cb.or(
            cb.like(cb.lower(root.get("title")), pattern, '\\'),
            cb.like(cb.lower(root.get("url")), pattern, '\\'),
            cb.like(cb.lower(cb.coalesce(root.<String>get("description"), "")), pattern, '\\')
        );
    }
    
    public static Specification<Bookmark> inCollection(String collectionId) {
        return (root, query, cb) -> {
            Subquery<String> links = query.subquery(String.class);
            var link = links.from(BookmarkCollection.class);
            links.select(link.get("bookmarkId"))
                 .where(cb.equal(link.get("collectionId"), collectionId));
            return root.get("bookmarkId").in(links);
        };
    }
    
    public static Specification<Bookmark> taggedWith(String tagId) {
        return (root, query, cb) -> {
            Subquery<String> links = query.subquery(String.class);
            var link = links.from(BookmarkTag.class);
            links.select(link.get("bookmarkId"))
                 .where(cb.equal(link.get("tagId"), tagId));
            return root.get("bookmarkId").in(links);
        };
    }
    
    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}

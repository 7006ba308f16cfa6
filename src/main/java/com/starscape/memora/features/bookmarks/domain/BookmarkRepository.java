package com.starscape.memora.features.bookmarks.domain;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Bookmark domain entity.
 * Every lookup and mutation is scoped by owner.
 */
public interface BookmarkRepository {
    Bookmark save(Bookmark bookmark);
    Bookmark saveAndFlush(Bookmark bookmark);
    Optional<Bookmark> findByBookmarkIdAndUserId(String bookmarkId, String userId);
    Optional<Bookmark> findFirstByUserIdOrderByCreatedAtDesc(String userId);
    boolean existsByUserIdAndUrl(String userId, String url);
    long countByUserId(String userId);
    List<BookmarkSummary> findSummariesByTag(String userId, String tagId);
    List<Bookmark> findByCollection(String userId, String collectionId);
    int deleteByBookmarkIdAndUserId(String bookmarkId, String userId);
}

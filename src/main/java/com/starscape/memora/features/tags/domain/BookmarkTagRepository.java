package com.starscape.memora.features.tags.domain;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Repository interface for BookmarkTag junction entity.
 */
public interface BookmarkTagRepository {
    BookmarkTag save(BookmarkTag bookmarkTag);
    List<BookmarkTag> findByBookmarkId(String bookmarkId);
    Optional<BookmarkTag> findFirstByBookmarkIdOrderByCreatedAtAsc(String bookmarkId);
    List<TagLink> findLinksByBookmarkIdIn(Set<String> bookmarkIds);
    int deleteByBookmarkIdAndTagIdIn(String bookmarkId, Set<String> tagIds);
    int deleteByTagId(String tagId);
}

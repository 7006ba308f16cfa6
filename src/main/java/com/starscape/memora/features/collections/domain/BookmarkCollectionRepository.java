package com.starscape.memora.features.collections.domain;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Repository interface for BookmarkCollection junction entity.
 */
public interface BookmarkCollectionRepository {
    BookmarkCollection save(BookmarkCollection link);
    List<BookmarkCollection> findByBookmarkId(String bookmarkId);
    Optional<BookmarkCollection> findFirstByBookmarkIdOrderByCreatedAtAsc(String bookmarkId);
    List<CollectionLink> findLinksByBookmarkIdIn(Set<String> bookmarkIds);
    int deleteByBookmarkIdAndCollectionIdIn(String bookmarkId, Set<String> collectionIds);
    
    /**
     * Link every bookmark whose only collection is {@code collectionId} to {@code targetCollectionId}.
     * 
     * @return number of bookmarks relinked
     */
    int relinkOrphans(String collectionId, String targetCollectionId);
    
    int deleteByCollectionId(String collectionId);
}

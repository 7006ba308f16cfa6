package com.starscape.memora.features.collections.infra;

import com.starscape.memora.features.collections.domain.BookmarkCollection;
import com.starscape.memora.features.collections.domain.BookmarkCollectionId;
import com.starscape.memora.features.collections.domain.BookmarkCollectionRepository;
import com.starscape.memora.features.collections.domain.CollectionLink;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * JPA repository implementation for BookmarkCollection junction entity.
 * The orphan relink is a single set-based native statement.
 */
@Repository
public interface JpaBookmarkCollectionRepository
        extends JpaRepository<BookmarkCollection, BookmarkCollectionId>, BookmarkCollectionRepository {
    
    @Override
    List<BookmarkCollection> findByBookmarkId(String bookmarkId);
    
    @Override
    Optional<BookmarkCollection> findFirstByBookmarkIdOrderByCreatedAtAsc(String bookmarkId);
    
    @Override
    @Query("SELECT new com.starscape.memora.features.collections.domain.CollectionLink(" +
           "bc.bookmarkId, c.collectionId, c.name) " +
           "FROM BookmarkCollection bc, Collection c " +
           "WHERE bc.collectionId = c.collectionId AND bc.bookmarkId IN :bookmarkIds " +
           "ORDER BY c.name ASC")
    List<CollectionLink> findLinksByBookmarkIdIn(@Param("bookmarkIds") Set<String> bookmarkIds);
    
    @Override
    @Modifying
    @Query("DELETE FROM BookmarkCollection bc WHERE bc.bookmarkId = :bookmarkId AND bc.collectionId IN :collectionIds")
    int deleteByBookmarkIdAndCollectionIdIn(
        @Param("bookmarkId") String bookmarkId,
        @Param("collectionIds") Set<String> collectionIds);
    
    @Override
    @Modifying
    @Query(value = "INSERT INTO bookmark_collections (bookmark_id, collection_id, created_at) " +
                   "SELECT bc.bookmark_id, :targetCollectionId, now() FROM bookmark_collections bc " +
                   "WHERE bc.collection_id = :collectionId " +
                   "AND NOT EXISTS (SELECT 1 FROM bookmark_collections other " +
                   "WHERE other.bookmark_id = bc.bookmark_id AND other.collection_id <> :collectionId) " +
                   "ON CONFLICT DO NOTHING",
           nativeQuery = true)
    int relinkOrphans(
        @Param("collectionId") String collectionId,
        @Param("targetCollectionId") String targetCollectionId);
    
    @Override
    @Modifying
    @Query("DELETE FROM BookmarkCollection bc WHERE bc.collectionId = :collectionId")
    int deleteByCollectionId(@Param("collectionId") String collectionId);
}

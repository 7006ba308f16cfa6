package com.starscape.memora.features.bookmarks.infra;

import com.starscape.memora.features.bookmarks.domain.Bookmark;
import com.starscape.memora.features.bookmarks.domain.BookmarkRepository;
import com.starscape.memora.features.bookmarks.domain.BookmarkSummary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * JPA repository implementation for Bookmark entity.
 * Filtered listing goes through {@link JpaSpecificationExecutor} with {@link BookmarkSpecifications}.
 */
@Repository
public interface JpaBookmarkRepository extends JpaRepository<Bookmark, String>,
        JpaSpecificationExecutor<Bookmark>, BookmarkRepository {
    
    @Override
    Optional<Bookmark> findByBookmarkIdAndUserId(String bookmarkId, String userId);
    
    @Override
    Optional<Bookmark> findFirstByUserIdOrderByCreatedAtDesc(String userId);
    
    @Override
    boolean existsByUserIdAndUrl(String userId, String url);
    
    @Override
    long countByUserId(String userId);
    
    @Override
    @Query("SELECT new com.starscape.memora.features.bookmarks.domain.BookmarkSummary(b.bookmarkId, b.title) " +
           "FROM Bookmark b, BookmarkTag bt " +
           "WHERE bt.bookmarkId = b.bookmarkId AND bt.tagId = :tagId AND b.userId = :userId " +
           "ORDER BY b.createdAt DESC")
    List<BookmarkSummary> findSummariesByTag(@Param("userId") String userId, @Param("tagId") String tagId);
    
    @Override
    @Query("SELECT b FROM Bookmark b, BookmarkCollection bc " +
           "WHERE bc.bookmarkId = b.bookmarkId AND bc.collectionId = :collectionId AND b.userId = :userId " +
           "ORDER BY b.createdAt DESC")
    List<Bookmark> findByCollection(@Param("userId") String userId, @Param("collectionId") String collectionId);
    
    /**
     * Owner check is part of the delete predicate; link rows go with the FK cascade.
     */
    @Override
    @Modifying
    @Query("DELETE FROM Bookmark b WHERE b.bookmarkId = :bookmarkId AND b.userId = :userId")
    int deleteByBookmarkIdAndUserId(@Param("bookmarkId") String bookmarkId, @Param("userId") String userId);
}

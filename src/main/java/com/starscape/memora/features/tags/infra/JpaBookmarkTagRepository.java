package com.starscape.memora.features.tags.infra;

import com.starscape.memora.features.tags.domain.BookmarkTag;
import com.starscape.memora.features.tags.domain.BookmarkTagId;
import com.starscape.memora.features.tags.domain.BookmarkTagRepository;
import com.starscape.memora.features.tags.domain.TagLink;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * JPA repository implementation for BookmarkTag junction entity.
 * Link removal uses bulk JPQL deletes so no link rows are loaded first.
 */
@Repository
public interface JpaBookmarkTagRepository extends JpaRepository<BookmarkTag, BookmarkTagId>, BookmarkTagRepository {
    
    @Override
    List<BookmarkTag> findByBookmarkId(String bookmarkId);
    
    @Override
    Optional<BookmarkTag> findFirstByBookmarkIdOrderByCreatedAtAsc(String bookmarkId);
    
    @Override
    @Query("SELECT new com.starscape.memora.features.tags.domain.TagLink(bt.bookmarkId, t.tagId, t.name) " +
           "FROM BookmarkTag bt, Tag t WHERE bt.tagId = t.tagId AND bt.bookmarkId IN :bookmarkIds " +
           "ORDER BY t.name ASC")
    List<TagLink> findLinksByBookmarkIdIn(@Param("bookmarkIds") Set<String> bookmarkIds);
    
    @Override
    @Modifying
    @Query("DELETE FROM BookmarkTag bt WHERE bt.bookmarkId = :bookmarkId AND bt.tagId IN :tagIds")
    int deleteByBookmarkIdAndTagIdIn(@Param("bookmarkId") String bookmarkId, @Param("tagIds") Set<String> tagIds);
    
    @Override
    @Modifying
    @Query("DELETE FROM BookmarkTag bt WHERE bt.tagId = :tagId")
    int deleteByTagId(@Param("tagId") String tagId);
}

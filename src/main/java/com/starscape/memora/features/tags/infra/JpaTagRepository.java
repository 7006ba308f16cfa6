package com.starscape.memora.features.tags.infra;

import com.starscape.memora.features.tags.domain.Tag;
import com.starscape.memora.features.tags.domain.TagRepository;
import com.starscape.memora.features.tags.domain.TagUsage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * JPA repository implementation for Tag entity.
 * Spring Data JPA automatically provides implementations for methods declared in TagRepository
 * that match JpaRepository methods (save, findById).
 */
@Repository
public interface JpaTagRepository extends JpaRepository<Tag, String>, TagRepository {
    
    @Override
    Optional<Tag> findByTagIdAndUserId(String tagId, String userId);
    
    @Override
    Optional<Tag> findByUserIdAndName(String userId, String name);
    
    @Override
    List<Tag> findByUserIdAndTagIdIn(String userId, Set<String> tagIds);
    
    @Override
    boolean existsByUserIdAndName(String userId, String name);
    
    @Override
    boolean existsByUserIdAndNameAndTagIdNot(String userId, String name, String tagId);
    
    @Override
    @Query("SELECT new com.starscape.memora.features.tags.domain.TagUsage(t.tagId, t.name, COUNT(bt.bookmarkId)) " +
           "FROM Tag t LEFT JOIN BookmarkTag bt ON bt.tagId = t.tagId " +
           "WHERE t.userId = :userId GROUP BY t.tagId, t.name ORDER BY t.name ASC")
    List<TagUsage> findUsageByUserId(@Param("userId") String userId);
    
    @Override
    @Modifying
    @Query(value = "INSERT INTO tags (tag_id, user_id, name, created_at) " +
                   "VALUES (:tagId, :userId, :name, :createdAt) " +
                   "ON CONFLICT (user_id, name) DO NOTHING",
           nativeQuery = true)
    int insertIfAbsent(
        @Param("tagId") String tagId,
        @Param("userId") String userId,
        @Param("name") String name,
        @Param("createdAt") Instant createdAt);
    
    @Override
    @Modifying
    @Query("DELETE FROM Tag t WHERE t.tagId = :tagId AND t.userId = :userId")
    int deleteByTagIdAndUserId(@Param("tagId") String tagId, @Param("userId") String userId);
}

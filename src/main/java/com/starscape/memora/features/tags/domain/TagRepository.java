package com.starscape.memora.features.tags.domain;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Repository interface for Tag domain entity.
 */
public interface TagRepository {
    Tag save(Tag tag);
    Optional<Tag> findById(String tagId);
    Optional<Tag> findByTagIdAndUserId(String tagId, String userId);
    Optional<Tag> findByUserIdAndName(String userId, String name);
    List<Tag> findByUserIdAndTagIdIn(String userId, Set<String> tagIds);
    boolean existsByUserIdAndName(String userId, String name);
    boolean existsByUserIdAndNameAndTagIdNot(String userId, String name, String tagId);
    List<TagUsage> findUsageByUserId(String userId);
    
    /**
     * Insert the tag unless (user, name) already exists.
     * A concurrent insert of the same name resolves to a no-op instead of a constraint error.
     * 
     * @return number of rows inserted (0 or 1)
     */
    int insertIfAbsent(String tagId, String userId, String name, Instant createdAt);
    
    int deleteByTagIdAndUserId(String tagId, String userId);
}

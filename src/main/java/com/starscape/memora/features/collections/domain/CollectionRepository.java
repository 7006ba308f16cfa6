package com.starscape.memora.features.collections.domain;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Repository interface for Collection domain entity.
 */
public interface CollectionRepository {
    Collection save(Collection collection);
    Optional<Collection> findByCollectionIdAndUserId(String collectionId, String userId);
    Optional<Collection> findBySystemTrueAndUserId(String userId);
    
    /**
     * Load the owner's system collection and hold a row lock on it until the transaction ends.
     */
    Optional<Collection> lockSystemCollection(String userId);
    
    List<Collection> findByUserIdAndCollectionIdIn(String userId, Set<String> collectionIds);
    boolean existsByUserIdAndName(String userId, String name);
    boolean existsByUserIdAndNameAndCollectionIdNot(String userId, String name, String collectionId);
    List<CollectionUsage> findUsageByUserId(String userId);
    int deleteNonSystem(String collectionId, String userId);
}

package com.starscape.memora.features.collections.infra;

import com.starscape.memora.features.collections.domain.Collection;
import com.starscape.memora.features.collections.domain.CollectionRepository;
import com.starscape.memora.features.collections.domain.CollectionUsage;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * JPA repository implementation for Collection entity.
 */
@Repository
public interface JpaCollectionRepository extends JpaRepository<Collection, String>, CollectionRepository {
    
    @Override
    Optional<Collection> findByCollectionIdAndUserId(String collectionId, String userId);
    
    @Override
    Optional<Collection> findBySystemTrueAndUserId(String userId);
    
    @Override
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Collection c WHERE c.userId = :userId AND c.system = true")
    Optional<Collection> lockSystemCollection(@Param("userId") String userId);
    
    @Override
    List<Collection> findByUserIdAndCollectionIdIn(String userId, Set<String> collectionIds);
    
    @Override
    boolean existsByUserIdAndName(String userId, String name);
    
    @Override
    boolean existsByUserIdAndNameAndCollectionIdNot(String userId, String name, String collectionId);
    
    @Override
    @Query("SELECT new com.starscape.memora.features.collections.domain.CollectionUsage(" +
           "c.collectionId, c.name, c.system, COUNT(bc.bookmarkId)) " +
           "FROM Collection c LEFT JOIN BookmarkCollection bc ON bc.collectionId = c.collectionId " +
           "WHERE c.userId = :userId GROUP BY c.collectionId, c.name, c.system ORDER BY c.name ASC")
    List<CollectionUsage> findUsageByUserId(@Param("userId") String userId);
    
    /**
     * The system flag is part of the predicate, so the protected collection can never be removed here.
     */
    @Override
    @Modifying
    @Query("DELETE FROM Collection c WHERE c.collectionId = :collectionId AND c.userId = :userId AND c.system = false")
    int deleteNonSystem(@Param("collectionId") String collectionId, @Param("userId") String userId);
}

package com.volunteermedia.repository;

import com.volunteermedia.model.AnimalComment;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for comments and session notes.
 *
 * Fixed-shape listings use JPQL; the activity feed and CSV export combine optional
 * filters through {@link CommentSpecifications}.
 */
@Repository
public interface AnimalCommentRepository extends JpaRepository<AnimalComment, Long>,
        JpaSpecificationExecutor<AnimalComment> {

    Optional<AnimalComment> findByIdAndAnimalIdAndDeletedAtIsNull(Long id, Long animalId);

    @Query(value = "SELECT c FROM AnimalComment c WHERE c.animalId = :animalId AND c.deletedAt IS NULL",
           countQuery = "SELECT COUNT(c) FROM AnimalComment c WHERE c.animalId = :animalId AND c.deletedAt IS NULL")
    Page<AnimalComment> findActiveByAnimal(Long animalId, Pageable pageable);

    /**
     * Comments carrying at least one of the given tag names (OR semantics).
     */
    @Query(value = "SELECT c FROM AnimalComment c WHERE c.animalId = :animalId AND c.deletedAt IS NULL " +
                   "AND EXISTS (SELECT t.id FROM AnimalComment c2 JOIN c2.tags t " +
                   "WHERE c2.id = c.id AND t.name IN :tagNames)",
           countQuery = "SELECT COUNT(c) FROM AnimalComment c WHERE c.animalId = :animalId AND c.deletedAt IS NULL " +
                        "AND EXISTS (SELECT t.id FROM AnimalComment c2 JOIN c2.tags t " +
                        "WHERE c2.id = c.id AND t.name IN :tagNames)")
    Page<AnimalComment> findActiveByAnimalAndTags(Long animalId, Collection<String> tagNames, Pageable pageable);

    @Query("SELECT c FROM AnimalComment c WHERE c.deletedAt IS NULL " +
           "AND c.animalId IN (SELECT a.id FROM Animal a WHERE a.groupId = :groupId AND a.deletedAt IS NULL) " +
           "ORDER BY c.createdAt DESC")
    List<AnimalComment> findLatestInGroup(Long groupId, Pageable pageable);

    @Query("SELECT c FROM AnimalComment c WHERE c.deletedAt IS NOT NULL " +
           "AND c.animalId IN (SELECT a.id FROM Animal a WHERE a.groupId = :groupId) " +
           "ORDER BY c.deletedAt DESC")
    List<AnimalComment> findDeletedInGroup(Long groupId);

    List<AnimalComment> findByDeletedAtIsNotNullOrderByDeletedAtDesc();

    long countByUserIdAndDeletedAtIsNull(Long userId);

    List<AnimalComment> findTop10ByUserIdAndDeletedAtIsNullOrderByCreatedAtDesc(Long userId);

    long countByDeletedAtIsNull();

    long countByDeletedAtIsNullAndCreatedAtAfter(Instant since);

    // ==================== STATISTICS ====================

    interface GroupActivity {
        Long getGroupId();
        long getCommentCount();
        Instant getLastActivity();
    }

    interface UserActivity {
        Long getUserId();
        long getCommentCount();
        Instant getLastActive();
        long getAnimalsInteracted();
    }

    interface TagUsage {
        Long getTagId();
        long getCommentCount();
        Instant getLastUsed();
    }

    @Query("SELECT a.groupId AS groupId, COUNT(c) AS commentCount, MAX(c.createdAt) AS lastActivity " +
           "FROM AnimalComment c, Animal a WHERE c.animalId = a.id AND c.deletedAt IS NULL " +
           "GROUP BY a.groupId")
    List<GroupActivity> summarizeByGroup();

    @Query("SELECT c.userId AS userId, COUNT(c) AS commentCount, MAX(c.createdAt) AS lastActive, " +
           "COUNT(DISTINCT c.animalId) AS animalsInteracted " +
           "FROM AnimalComment c WHERE c.deletedAt IS NULL GROUP BY c.userId")
    List<UserActivity> summarizeByUser();

    @Query("SELECT t.id AS tagId, COUNT(c) AS commentCount, MAX(c.createdAt) AS lastUsed " +
           "FROM AnimalComment c JOIN c.tags t WHERE c.deletedAt IS NULL AND t.groupId = :groupId " +
           "GROUP BY t.id")
    List<TagUsage> summarizeTagUsage(Long groupId);
}

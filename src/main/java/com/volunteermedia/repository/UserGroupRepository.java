package com.volunteermedia.repository;

import com.volunteermedia.model.UserGroup;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface UserGroupRepository extends JpaRepository<UserGroup, UserGroup.Key> {

    Optional<UserGroup> findByUserIdAndGroupId(Long userId, Long groupId);

    boolean existsByUserIdAndGroupId(Long userId, Long groupId);

    boolean existsByUserIdAndGroupAdminTrue(Long userId);

    List<UserGroup> findByUserId(Long userId);

    /**
     * Members of a group with their user row, skipping soft-deleted users.
     */
    @Query("SELECT ug FROM UserGroup ug JOIN FETCH ug.user u " +
           "WHERE ug.groupId = :groupId AND u.deletedAt IS NULL ORDER BY u.username")
    List<UserGroup> findActiveMembers(Long groupId);

    @Query("SELECT COUNT(ug) FROM UserGroup ug, User u " +
           "WHERE ug.userId = u.id AND ug.groupId = :groupId AND u.deletedAt IS NULL")
    long countActiveMembers(Long groupId);

    @Modifying
    @Query("DELETE FROM UserGroup ug WHERE ug.userId = :userId")
    void deleteByUserId(Long userId);
}

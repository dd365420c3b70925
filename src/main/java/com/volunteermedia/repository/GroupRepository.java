package com.volunteermedia.repository;

import com.volunteermedia.model.Group;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface GroupRepository extends JpaRepository<Group, Long> {

    Optional<Group> findByIdAndDeletedAtIsNull(Long id);

    Optional<Group> findByNameIgnoreCase(String name);

    List<Group> findByDeletedAtIsNullOrderByNameAsc();

    boolean existsByNameIgnoreCaseAndDeletedAtIsNull(String name);

    boolean existsByNameIgnoreCaseAndDeletedAtIsNullAndIdNot(String name, Long id);

    List<Group> findByGroupmeEnabledTrueAndDeletedAtIsNull();

    @Query("SELECT g FROM Group g WHERE g.deletedAt IS NULL " +
           "AND g.id IN (SELECT ug.groupId FROM UserGroup ug WHERE ug.userId = :userId) ORDER BY g.name")
    List<Group> findGroupsForUser(Long userId);

    @Query("SELECT g FROM Group g WHERE g.deletedAt IS NULL " +
           "AND g.id IN (SELECT ug.groupId FROM UserGroup ug WHERE ug.userId = :userId AND ug.groupAdmin = true) " +
           "ORDER BY g.name")
    List<Group> findGroupsAdministeredBy(Long userId);

    long countByDeletedAtIsNull();
}

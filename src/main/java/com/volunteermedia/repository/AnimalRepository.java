package com.volunteermedia.repository;

import com.volunteermedia.model.Animal;
import com.volunteermedia.model.AnimalStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for animals.
 *
 * Name filters are passed as ready-made lowercase LIKE patterns ("%bel%"); an empty
 * filter is simply "%%", which keeps the queries free of optional-parameter tricks.
 */
@Repository
public interface AnimalRepository extends JpaRepository<Animal, Long> {

    Optional<Animal> findByIdAndDeletedAtIsNull(Long id);

    Optional<Animal> findByIdAndGroupIdAndDeletedAtIsNull(Long id, Long groupId);

    @Query("SELECT a FROM Animal a WHERE a.groupId = :groupId AND a.deletedAt IS NULL " +
           "AND a.status IN :statuses AND LOWER(a.name) LIKE :namePattern ORDER BY a.name")
    List<Animal> searchInGroup(Long groupId, Collection<AnimalStatus> statuses, String namePattern);

    @Query("SELECT a FROM Animal a WHERE a.deletedAt IS NULL " +
           "AND a.status IN :statuses AND LOWER(a.name) LIKE :namePattern ORDER BY a.groupId, a.name")
    List<Animal> searchAll(Collection<AnimalStatus> statuses, String namePattern);

    @Query("SELECT a FROM Animal a WHERE a.groupId IN :groupIds AND a.deletedAt IS NULL " +
           "AND a.status IN :statuses AND LOWER(a.name) LIKE :namePattern ORDER BY a.groupId, a.name")
    List<Animal> searchInGroups(Collection<Long> groupIds, Collection<AnimalStatus> statuses, String namePattern);

    List<Animal> findByGroupIdAndNameIgnoreCaseAndDeletedAtIsNull(Long groupId, String name);

    List<Animal> findByIdInAndDeletedAtIsNull(Collection<Long> ids);

    List<Animal> findByGroupIdAndDeletedAtIsNullOrderByNameAsc(Long groupId);

    List<Animal> findByDeletedAtIsNullOrderByGroupIdAscNameAsc();

    Optional<Animal> findByProtocolDocumentUrlAndDeletedAtIsNull(String protocolDocumentUrl);

    long countByStatusAndDeletedAtIsNull(AnimalStatus status);

    long countByGroupIdAndDeletedAtIsNull(Long groupId);
}

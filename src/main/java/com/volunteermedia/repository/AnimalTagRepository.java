package com.volunteermedia.repository;

import com.volunteermedia.model.AnimalTag;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface AnimalTagRepository extends JpaRepository<AnimalTag, Long> {

    List<AnimalTag> findByGroupIdOrderByCategoryAscNameAsc(Long groupId);

    Optional<AnimalTag> findByIdAndGroupId(Long id, Long groupId);

    boolean existsByGroupIdAndNameIgnoreCase(Long groupId, String name);

    boolean existsByGroupIdAndNameIgnoreCaseAndIdNot(Long groupId, String name, Long id);

    List<AnimalTag> findByGroupIdAndIdIn(Long groupId, Collection<Long> ids);

    @Modifying
    @Query(value = "DELETE FROM animal_animal_tags WHERE animal_tag_id = :tagId", nativeQuery = true)
    void detachFromAnimals(Long tagId);
}

package com.volunteermedia.repository;

import com.volunteermedia.model.AnimalImage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AnimalImageRepository extends JpaRepository<AnimalImage, Long> {

    /**
     * Gallery order: profile picture first, then newest.
     */
    List<AnimalImage> findByAnimalIdAndDeletedAtIsNullOrderByProfilePictureDescCreatedAtDesc(Long animalId);

    Optional<AnimalImage> findByIdAndAnimalIdAndDeletedAtIsNull(Long id, Long animalId);

    List<AnimalImage> findByAnimalIdAndProfilePictureTrueAndDeletedAtIsNull(Long animalId);

    Optional<AnimalImage> findByFileId(String fileId);

    @Query("SELECT i FROM AnimalImage i WHERE i.deletedAt IS NOT NULL " +
           "AND i.animalId IN (SELECT a.id FROM Animal a WHERE a.groupId = :groupId) " +
           "ORDER BY i.deletedAt DESC")
    List<AnimalImage> findDeletedInGroup(Long groupId);

    List<AnimalImage> findByDeletedAtIsNotNullOrderByDeletedAtDesc();
}

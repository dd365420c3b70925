package com.volunteermedia.repository;

import com.volunteermedia.model.AnimalNameHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AnimalNameHistoryRepository extends JpaRepository<AnimalNameHistory, Long> {

    List<AnimalNameHistory> findByAnimalIdOrderByCreatedAtDesc(Long animalId);
}

package com.volunteermedia.repository;

import com.volunteermedia.model.Announcement;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AnnouncementRepository extends JpaRepository<Announcement, Long> {

    List<Announcement> findTop10ByDeletedAtIsNullOrderByCreatedAtDesc();

    Optional<Announcement> findByIdAndDeletedAtIsNull(Long id);
}

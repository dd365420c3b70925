package com.volunteermedia.repository;

import com.volunteermedia.model.GroupUpdate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface GroupUpdateRepository extends JpaRepository<GroupUpdate, Long>,
        JpaSpecificationExecutor<GroupUpdate> {

    List<GroupUpdate> findByGroupIdAndDeletedAtIsNullOrderByCreatedAtDesc(Long groupId);

    Optional<GroupUpdate> findByIdAndDeletedAtIsNull(Long id);
}

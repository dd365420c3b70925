package com.volunteermedia.repository;

import com.volunteermedia.model.Protocol;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ProtocolRepository extends JpaRepository<Protocol, Long> {

    List<Protocol> findByGroupIdOrderByOrderIndexAscCreatedAtAsc(Long groupId);

    Optional<Protocol> findByIdAndGroupId(Long id, Long groupId);
}

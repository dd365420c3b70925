package com.volunteermedia.repository;

import com.volunteermedia.model.CommentTag;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface CommentTagRepository extends JpaRepository<CommentTag, Long> {

    /**
     * System tags first, then alphabetical.
     */
    List<CommentTag> findByGroupIdAndDeletedAtIsNullOrderBySystemDescNameAsc(Long groupId);

    Optional<CommentTag> findByIdAndGroupIdAndDeletedAtIsNull(Long id, Long groupId);

    Optional<CommentTag> findByGroupIdAndNameIgnoreCaseAndDeletedAtIsNull(Long groupId, String name);

    // Includes soft-deleted rows; the (group, name) constraint spans them
    Optional<CommentTag> findByGroupIdAndNameIgnoreCase(Long groupId, String name);

    List<CommentTag> findByGroupIdAndIdInAndDeletedAtIsNull(Long groupId, Collection<Long> ids);
}

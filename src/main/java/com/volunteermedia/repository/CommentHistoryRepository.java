package com.volunteermedia.repository;

import com.volunteermedia.model.CommentHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CommentHistoryRepository extends JpaRepository<CommentHistory, Long> {

    List<CommentHistory> findByCommentIdOrderByCreatedAtDesc(Long commentId);
}

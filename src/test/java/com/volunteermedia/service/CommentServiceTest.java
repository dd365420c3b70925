package com.volunteermedia.service;

import com.volunteermedia.dto.CommentRequest;
import com.volunteermedia.exception.BadRequestException;
import com.volunteermedia.exception.ForbiddenException;
import com.volunteermedia.model.Animal;
import com.volunteermedia.model.AnimalComment;
import com.volunteermedia.model.CommentHistory;
import com.volunteermedia.model.SessionMetadata;
import com.volunteermedia.repository.AnimalCommentRepository;
import com.volunteermedia.repository.AnimalRepository;
import com.volunteermedia.repository.CommentHistoryRepository;
import com.volunteermedia.repository.CommentTagRepository;
import com.volunteermedia.security.AuthenticatedUser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CommentServiceTest {

    private static final AuthenticatedUser AUTHOR = new AuthenticatedUser(5L, false);
    private static final AuthenticatedUser OTHER = new AuthenticatedUser(6L, false);

    @Mock
    private AnimalCommentRepository commentRepository;
    @Mock
    private CommentHistoryRepository historyRepository;
    @Mock
    private CommentTagRepository commentTagRepository;
    @Mock
    private AnimalRepository animalRepository;
    @Mock
    private GroupAccessService groupAccessService;

    private CommentService commentService;

    @BeforeEach
    void setUp() {
        commentService = new CommentService(commentRepository, historyRepository, commentTagRepository,
                animalRepository, groupAccessService);
    }

    private void animalExists() {
        Animal animal = new Animal();
        animal.setId(10L);
        animal.setGroupId(2L);
        when(animalRepository.findByIdAndGroupIdAndDeletedAtIsNull(10L, 2L)).thenReturn(Optional.of(animal));
    }

    private AnimalComment existingComment() {
        AnimalComment comment = new AnimalComment();
        comment.setId(30L);
        comment.setAnimalId(10L);
        comment.setUserId(5L);
        comment.setContent("Walked well");
        when(commentRepository.findByIdAndAnimalIdAndDeletedAtIsNull(30L, 10L)).thenReturn(Optional.of(comment));
        return comment;
    }

    @Test
    void limitIsClampedAndDefaulted() {
        assertThat(CommentService.clampLimit(null, 10)).isEqualTo(10);
        assertThat(CommentService.clampLimit(0, 20)).isEqualTo(20);
        assertThat(CommentService.clampLimit(500, 20)).isEqualTo(100);
        assertThat(CommentService.clampLimit(25, 20)).isEqualTo(25);
    }

    @Test
    void tagListIsSplitAndTrimmed() {
        assertThat(CommentService.splitCsv(" behavior, ,medical ")).containsExactly("behavior", "medical");
        assertThat(CommentService.splitCsv(null)).isEmpty();
    }

    @Test
    void listReportsPaging() {
        animalExists();
        AnimalComment c = new AnimalComment();
        when(commentRepository.findActiveByAnimal(eq(10L), any(Pageable.class)))
                .thenAnswer(inv -> new PageImpl<>(List.of(c), inv.getArgument(1), 11));

        Map<String, Object> body = commentService.listComments(AUTHOR, 2L, 10L, 1, 3, null, null);

        assertThat(body)
                .containsEntry("total", 11L)
                .containsEntry("limit", 1)
                .containsEntry("offset", 3)
                .containsEntry("hasMore", true);
    }

    @Test
    void listFiltersByTagNames() {
        animalExists();
        when(commentRepository.findActiveByAnimalAndTags(eq(10L), eq(List.of("medical")), any(Pageable.class)))
                .thenAnswer(inv -> new PageImpl<>(List.of(), inv.getArgument(2), 0));

        Map<String, Object> body = commentService.listComments(AUTHOR, 2L, 10L, null, null, "asc", "medical");

        assertThat(body).containsEntry("total", 0L).containsEntry("hasMore", false);
    }

    @Test
    void createNeedsContentOrImage() {
        animalExists();
        CommentRequest request = new CommentRequest();
        request.setContent("   ");

        assertThatThrownBy(() -> commentService.createComment(AUTHOR, 2L, 10L, request))
                .isInstanceOf(BadRequestException.class)
                .hasMessage("Content or image is required");
    }

    @Test
    void createEscapesSessionMetadata() {
        animalExists();
        when(commentRepository.save(any(AnimalComment.class))).thenAnswer(inv -> inv.getArgument(0));

        CommentRequest request = new CommentRequest();
        request.setContent(" Good session ");
        request.setMetadata(SessionMetadata.builder().sessionGoal("<sit>").sessionRating(5).build());

        AnimalComment saved = commentService.createComment(AUTHOR, 2L, 10L, request);

        assertThat(saved.getContent()).isEqualTo("Good session");
        assertThat(saved.getUserId()).isEqualTo(5L);
        assertThat(saved.getMetadata().getSessionGoal()).isEqualTo("&lt;sit&gt;");
    }

    @Test
    void onlyAuthorMayEdit() {
        animalExists();
        existingComment();
        CommentRequest request = new CommentRequest();
        request.setContent("changed");

        assertThatThrownBy(() -> commentService.updateComment(OTHER, 2L, 10L, 30L, request))
                .isInstanceOf(ForbiddenException.class)
                .hasMessage("You can only edit your own comments");
        verify(historyRepository, never()).save(any());
    }

    @Test
    void editKeepsPreviousVersion() {
        animalExists();
        existingComment();
        when(commentRepository.save(any(AnimalComment.class))).thenAnswer(inv -> inv.getArgument(0));
        CommentRequest request = new CommentRequest();
        request.setContent("Walked very well");

        AnimalComment updated = commentService.updateComment(AUTHOR, 2L, 10L, 30L, request);

        ArgumentCaptor<CommentHistory> history = ArgumentCaptor.forClass(CommentHistory.class);
        verify(historyRepository).save(history.capture());
        assertThat(history.getValue().getContent()).isEqualTo("Walked well");
        assertThat(history.getValue().getEditedBy()).isEqualTo(5L);
        assertThat(updated.getContent()).isEqualTo("Walked very well");
    }

    @Test
    void groupAdminMayDeleteOthersComments() {
        animalExists();
        AnimalComment comment = existingComment();
        when(groupAccessService.canModerate(OTHER, 2L)).thenReturn(true);

        commentService.deleteComment(OTHER, 2L, 10L, 30L);

        assertThat(comment.getDeletedAt()).isNotNull();
    }

    @Test
    void memberMayNotDeleteOthersComments() {
        animalExists();
        existingComment();
        when(groupAccessService.canModerate(OTHER, 2L)).thenReturn(false);

        assertThatThrownBy(() -> commentService.deleteComment(OTHER, 2L, 10L, 30L))
                .isInstanceOf(ForbiddenException.class)
                .hasMessage("You can only delete your own comments");
    }
}

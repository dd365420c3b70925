package com.volunteermedia.service;

import com.volunteermedia.exception.ConflictException;
import com.volunteermedia.model.Group;
import com.volunteermedia.repository.AnimalCommentRepository;
import com.volunteermedia.repository.AnimalRepository;
import com.volunteermedia.repository.CommentTagRepository;
import com.volunteermedia.repository.GroupRepository;
import com.volunteermedia.repository.UserGroupRepository;
import com.volunteermedia.repository.UserRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SeedServiceTest {

    @Mock
    private GroupRepository groupRepository;
    @Mock
    private UserRepository userRepository;
    @Mock
    private UserGroupRepository userGroupRepository;
    @Mock
    private AnimalRepository animalRepository;
    @Mock
    private AnimalCommentRepository commentRepository;
    @Mock
    private CommentTagRepository commentTagRepository;
    @Mock
    private CommentTagService commentTagService;
    @Mock
    private SiteSettingService siteSettingService;
    @Mock
    private AuthService authService;

    @InjectMocks
    private SeedService seedService;

    @Test
    void refusesWhenOtherUsersExistWithoutForce() {
        when(userRepository.countByDeletedAtIsNull()).thenReturn(4L);

        assertThatThrownBy(() -> seedService.seedDemoData(1L, false))
                .isInstanceOf(ConflictException.class)
                .hasMessage("Database already contains users. Set force to seed anyway.");

        verify(groupRepository, never()).findByNameIgnoreCase(anyString());
        verifyNoInteractions(animalRepository, commentRepository, authService);
    }

    @Test
    void ensureDefaultsCreatesMissingGroupsWithSystemTags() {
        Group dogs = new Group();
        dogs.setId(1L);
        dogs.setName("dogs");
        when(groupRepository.findByNameIgnoreCase("dogs")).thenReturn(Optional.of(dogs));
        when(groupRepository.findByNameIgnoreCase("cats")).thenReturn(Optional.empty());
        when(groupRepository.findByNameIgnoreCase("modsquad")).thenReturn(Optional.empty());
        when(groupRepository.save(any(Group.class))).thenAnswer(inv -> {
            Group saved = inv.getArgument(0);
            saved.setId(saved.getName().equals("cats") ? 2L : 3L);
            return saved;
        });

        seedService.ensureDefaults();

        ArgumentCaptor<Group> created = ArgumentCaptor.forClass(Group.class);
        verify(groupRepository, times(2)).save(created.capture());
        assertThat(created.getAllValues()).extracting(Group::getName).containsExactly("cats", "modsquad");
        verify(commentTagService).ensureSystemTags(1L);
        verify(commentTagService).ensureSystemTags(2L);
        verify(commentTagService).ensureSystemTags(3L);
        verify(siteSettingService).ensureDefaults();
    }
}

package com.volunteermedia.service;

import com.volunteermedia.dto.AnimalRequest;
import com.volunteermedia.dto.BulkAnimalUpdateRequest;
import com.volunteermedia.exception.BadRequestException;
import com.volunteermedia.exception.ForbiddenException;
import com.volunteermedia.model.Animal;
import com.volunteermedia.model.AnimalNameHistory;
import com.volunteermedia.model.AnimalStatus;
import com.volunteermedia.model.AnimalTag;
import com.volunteermedia.model.Group;
import com.volunteermedia.repository.AnimalNameHistoryRepository;
import com.volunteermedia.repository.AnimalRepository;
import com.volunteermedia.repository.AnimalTagRepository;
import com.volunteermedia.repository.GroupRepository;
import com.volunteermedia.security.AuthenticatedUser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnimalServiceTest {

    private static final AuthenticatedUser VOLUNTEER = new AuthenticatedUser(5L, false);
    private static final AuthenticatedUser ADMIN = new AuthenticatedUser(1L, true);

    @Mock
    private AnimalRepository animalRepository;
    @Mock
    private AnimalTagRepository animalTagRepository;
    @Mock
    private AnimalNameHistoryRepository nameHistoryRepository;
    @Mock
    private GroupRepository groupRepository;
    @Mock
    private GroupAccessService groupAccessService;

    private AnimalService animalService;

    @BeforeEach
    void setUp() {
        animalService = new AnimalService(animalRepository, animalTagRepository, nameHistoryRepository,
                groupRepository, groupAccessService);
    }

    private static Animal animal(Long id, Long groupId, AnimalStatus status) {
        Animal animal = new Animal();
        animal.setId(id);
        animal.setGroupId(groupId);
        animal.setName("Buddy");
        animal.setStatus(status);
        return animal;
    }

    private static Group group(Long id) {
        Group group = new Group();
        group.setId(id);
        group.setName("group-" + id);
        return group;
    }

    @Nested
    class StatusTransitions {

        private final Instant now = Instant.parse("2026-04-01T12:00:00Z");

        @Test
        void fosterSetsFosterStartAndClearsOthers() {
            Animal animal = animal(1L, 1L, AnimalStatus.BITE_QUARANTINE);
            animal.setQuarantineStartDate(now.minusSeconds(3600));

            AnimalService.applyStatusChange(animal, AnimalStatus.FOSTER, null, now);

            assertThat(animal.getStatus()).isEqualTo(AnimalStatus.FOSTER);
            assertThat(animal.getFosterStartDate()).isEqualTo(now);
            assertThat(animal.getQuarantineStartDate()).isNull();
            assertThat(animal.getLastStatusChange()).isEqualTo(now);
        }

        @Test
        void quarantineUsesGivenStartDate() {
            Animal animal = animal(1L, 1L, AnimalStatus.AVAILABLE);
            Instant bite = Instant.parse("2026-03-30T08:00:00Z");

            AnimalService.applyStatusChange(animal, AnimalStatus.BITE_QUARANTINE, bite, now);

            assertThat(animal.getQuarantineStartDate()).isEqualTo(bite);
        }

        @Test
        void returningFromArchivedCountsAsReturn() {
            Animal animal = animal(1L, 1L, AnimalStatus.ARCHIVED);
            animal.setArchivedDate(now.minusSeconds(86400));
            animal.setReturnCount(1);

            AnimalService.applyStatusChange(animal, AnimalStatus.AVAILABLE, null, now);

            assertThat(animal.getReturnCount()).isEqualTo(2);
            assertThat(animal.isReturned()).isTrue();
            assertThat(animal.getArchivedDate()).isNull();
        }

        @Test
        void unchangedStatusIsNoOp() {
            Animal animal = animal(1L, 1L, AnimalStatus.FOSTER);
            Instant fosterStart = now.minusSeconds(7200);
            animal.setFosterStartDate(fosterStart);

            AnimalService.applyStatusChange(animal, AnimalStatus.FOSTER, null, now);

            assertThat(animal.getFosterStartDate()).isEqualTo(fosterStart);
            assertThat(animal.getLastStatusChange()).isNull();
        }
    }

    @Test
    void statusFilterDefaultsAndLists() {
        assertThat(AnimalService.parseStatuses(null, AnimalService.DEFAULT_LIST_STATUSES))
                .containsExactlyInAnyOrder(AnimalStatus.AVAILABLE, AnimalStatus.BITE_QUARANTINE);
        assertThat(AnimalService.parseStatuses("all", AnimalService.DEFAULT_LIST_STATUSES))
                .isEqualTo(EnumSet.allOf(AnimalStatus.class));
        assertThat(AnimalService.parseStatuses("foster, archived", AnimalService.DEFAULT_LIST_STATUSES))
                .containsExactlyInAnyOrder(AnimalStatus.FOSTER, AnimalStatus.ARCHIVED);
        assertThatThrownBy(() -> AnimalService.parseStatuses("adopted", AnimalService.DEFAULT_LIST_STATUSES))
                .isInstanceOf(BadRequestException.class)
                .hasMessage("Invalid status 'adopted'");
    }

    @Test
    void namePatternIsCaseInsensitiveSubstring() {
        assertThat(AnimalService.namePattern(" Bud ")).isEqualTo("%bud%");
        assertThat(AnimalService.namePattern(null)).isEqualTo("%%");
    }

    @Test
    void createDerivesAgeFromBirthDate() {
        when(groupRepository.findByIdAndDeletedAtIsNull(2L)).thenReturn(Optional.of(group(2L)));
        when(animalRepository.save(any(Animal.class))).thenAnswer(inv -> inv.getArgument(0));

        AnimalRequest request = new AnimalRequest();
        request.setName(" Luna ");
        request.setAge(9);
        request.setEstimatedBirthDate(LocalDate.now().minusYears(3).minusDays(2));
        request.setStatus("foster");

        Animal created = animalService.createAnimal(VOLUNTEER, 2L, request);

        assertThat(created.getName()).isEqualTo("Luna");
        assertThat(created.getAge()).isEqualTo(3);
        assertThat(created.getStatus()).isEqualTo(AnimalStatus.FOSTER);
        assertThat(created.getFosterStartDate()).isNotNull();
        assertThat(created.getArrivalDate()).isNotNull();
    }

    @Test
    void createRequiresName() {
        when(groupRepository.findByIdAndDeletedAtIsNull(2L)).thenReturn(Optional.of(group(2L)));
        AnimalRequest request = new AnimalRequest();
        request.setName("  ");

        assertThatThrownBy(() -> animalService.createAnimal(VOLUNTEER, 2L, request))
                .isInstanceOf(BadRequestException.class)
                .hasMessage("Name is required");
    }

    @Test
    void renameRecordsHistory() {
        Animal existing = animal(10L, 2L, AnimalStatus.AVAILABLE);
        when(animalRepository.findByIdAndGroupIdAndDeletedAtIsNull(10L, 2L)).thenReturn(Optional.of(existing));
        when(animalRepository.save(any(Animal.class))).thenAnswer(inv -> inv.getArgument(0));

        AnimalRequest request = new AnimalRequest();
        request.setName("Buddy Boy");

        animalService.updateAnimal(VOLUNTEER, 2L, 10L, request);

        ArgumentCaptor<AnimalNameHistory> history = ArgumentCaptor.forClass(AnimalNameHistory.class);
        verify(nameHistoryRepository).save(history.capture());
        assertThat(history.getValue().getOldName()).isEqualTo("Buddy");
        assertThat(history.getValue().getNewName()).isEqualTo("Buddy Boy");
        assertThat(history.getValue().getChangedBy()).isEqualTo(5L);
    }

    @Test
    void updateWithSameNameWritesNoHistory() {
        Animal existing = animal(10L, 2L, AnimalStatus.AVAILABLE);
        when(animalRepository.findByIdAndGroupIdAndDeletedAtIsNull(10L, 2L)).thenReturn(Optional.of(existing));
        when(animalRepository.save(any(Animal.class))).thenAnswer(inv -> inv.getArgument(0));

        AnimalRequest request = new AnimalRequest();
        request.setName("Buddy");
        request.setStatus("bite_quarantine");

        Animal updated = animalService.updateAnimal(VOLUNTEER, 2L, 10L, request);

        assertThat(updated.getStatus()).isEqualTo(AnimalStatus.BITE_QUARANTINE);
        assertThat(updated.getQuarantineStartDate()).isNotNull();
        verify(nameHistoryRepository, never()).save(any());
    }

    @Test
    void setTagsKeepsOnlyTagsOfTheGroup() {
        Animal existing = animal(10L, 2L, AnimalStatus.AVAILABLE);
        AnimalTag calm = new AnimalTag();
        calm.setId(3L);
        calm.setGroupId(2L);
        calm.setName("calm");
        when(animalRepository.findByIdAndGroupIdAndDeletedAtIsNull(10L, 2L)).thenReturn(Optional.of(existing));
        when(animalTagRepository.findByGroupIdAndIdIn(2L, List.of(3L, 99L))).thenReturn(List.of(calm));
        when(animalRepository.save(any(Animal.class))).thenAnswer(inv -> inv.getArgument(0));

        Animal updated = animalService.setTags(VOLUNTEER, 2L, 10L, List.of(3L, 99L));

        assertThat(updated.getTags()).containsExactly(calm);
    }

    @Test
    void duplicateCheckRequiresName() {
        assertThatThrownBy(() -> animalService.checkDuplicates(VOLUNTEER, 2L, " "))
                .isInstanceOf(BadRequestException.class)
                .hasMessage("name parameter is required");
    }

    @Test
    void duplicateCheckReportsMatches() {
        when(animalRepository.findByGroupIdAndNameIgnoreCaseAndDeletedAtIsNull(2L, "Buddy"))
                .thenReturn(List.of(animal(1L, 2L, AnimalStatus.AVAILABLE), animal(2L, 2L, AnimalStatus.ARCHIVED)));

        Map<String, Object> result = animalService.checkDuplicates(VOLUNTEER, 2L, "Buddy");

        assertThat(result).containsEntry("count", 2).containsEntry("has_duplicates", true);
    }

    @Nested
    class BulkUpdate {

        @Test
        void requiresAnimalIds() {
            BulkAnimalUpdateRequest request = new BulkAnimalUpdateRequest();
            request.setStatus("foster");

            assertThatThrownBy(() -> animalService.bulkUpdate(ADMIN, request))
                    .hasMessage("No animal IDs provided");
        }

        @Test
        void requiresSomethingToChange() {
            BulkAnimalUpdateRequest request = new BulkAnimalUpdateRequest();
            request.setAnimalIds(List.of(1L));

            assertThatThrownBy(() -> animalService.bulkUpdate(ADMIN, request))
                    .hasMessage("No updates provided");
        }

        @Test
        void movingGroupsClearsTagsAndChangesStatus() {
            Animal a = animal(1L, 2L, AnimalStatus.AVAILABLE);
            a.getTags().add(new AnimalTag());
            when(groupRepository.findByIdAndDeletedAtIsNull(3L)).thenReturn(Optional.of(group(3L)));
            when(animalRepository.findByIdInAndDeletedAtIsNull(List.of(1L))).thenReturn(List.of(a));

            BulkAnimalUpdateRequest request = new BulkAnimalUpdateRequest();
            request.setAnimalIds(List.of(1L));
            request.setGroupId(3L);
            request.setStatus("archived");

            int count = animalService.bulkUpdate(ADMIN, request);

            assertThat(count).isEqualTo(1);
            assertThat(a.getGroupId()).isEqualTo(3L);
            assertThat(a.getTags()).isEmpty();
            assertThat(a.getStatus()).isEqualTo(AnimalStatus.ARCHIVED);
            assertThat(a.getArchivedDate()).isNotNull();
        }

        @Test
        void groupAdminCannotTouchOtherGroups() {
            when(animalRepository.findByIdInAndDeletedAtIsNull(List.of(1L, 2L)))
                    .thenReturn(List.of(animal(1L, 2L, AnimalStatus.AVAILABLE), animal(2L, 4L, AnimalStatus.AVAILABLE)));
            when(groupRepository.findGroupsAdministeredBy(5L)).thenReturn(List.of(group(2L)));

            BulkAnimalUpdateRequest request = new BulkAnimalUpdateRequest();
            request.setAnimalIds(List.of(1L, 2L));
            request.setStatus("foster");

            assertThatThrownBy(() -> animalService.bulkUpdate(VOLUNTEER, request))
                    .isInstanceOf(ForbiddenException.class)
                    .hasMessage("You can only update animals in groups you administer");
            verify(animalRepository, never()).saveAll(any());
        }
    }

    @Test
    void bulkListingNeedsAnAdministeredGroup() {
        when(groupRepository.findGroupsAdministeredBy(5L)).thenReturn(List.of());

        assertThatThrownBy(() -> animalService.listBulkAnimals(VOLUNTEER, null, null, null))
                .isInstanceOf(ForbiddenException.class);
    }
}

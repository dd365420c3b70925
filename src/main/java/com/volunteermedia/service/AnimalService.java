package com.volunteermedia.service;

import com.volunteermedia.dto.AnimalRequest;
import com.volunteermedia.dto.BulkAnimalUpdateRequest;
import com.volunteermedia.exception.BadRequestException;
import com.volunteermedia.exception.ForbiddenException;
import com.volunteermedia.exception.NotFoundException;
import com.volunteermedia.model.Animal;
import com.volunteermedia.model.AnimalNameHistory;
import com.volunteermedia.model.AnimalStatus;
import com.volunteermedia.model.AnimalTimeline;
import com.volunteermedia.model.Group;
import com.volunteermedia.repository.AnimalNameHistoryRepository;
import com.volunteermedia.repository.AnimalRepository;
import com.volunteermedia.repository.AnimalTagRepository;
import com.volunteermedia.repository.GroupRepository;
import com.volunteermedia.security.AuthenticatedUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Animal profiles: listing and search, CRUD, status transitions, tags, and the bulk tools
 * used by site and group admins.
 *
 * STATUS TRANSITIONS:
 * ===================
 * available        clears foster/quarantine/archived dates; coming back from archived
 *                  counts as a return (return_count + 1, is_returned = true)
 * foster           sets foster_start_date, clears the others
 * bite_quarantine  sets quarantine_start_date (given or now), clears the others
 * archived         sets archived_date
 *
 * Any actual change of status also stamps last_status_change.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnimalService {

    static final Set<AnimalStatus> DEFAULT_LIST_STATUSES = EnumSet.of(AnimalStatus.AVAILABLE, AnimalStatus.BITE_QUARANTINE);

    private final AnimalRepository animalRepository;
    private final AnimalTagRepository animalTagRepository;
    private final AnimalNameHistoryRepository nameHistoryRepository;
    private final GroupRepository groupRepository;
    private final GroupAccessService groupAccessService;

    // ==================== GROUP SCOPED ====================

    @Transactional(readOnly = true)
    public List<Animal> listAnimals(AuthenticatedUser user, Long groupId, String status, String name) {
        groupAccessService.requireAccess(user, groupId);
        return animalRepository.searchInGroup(groupId, parseStatuses(status, DEFAULT_LIST_STATUSES), namePattern(name));
    }

    @Transactional(readOnly = true)
    public Animal getAnimal(AuthenticatedUser user, Long groupId, Long animalId) {
        groupAccessService.requireAccess(user, groupId);
        return requireAnimal(groupId, animalId);
    }

    @Transactional(readOnly = true)
    public Map<String, Object> checkDuplicates(AuthenticatedUser user, Long groupId, String name) {
        groupAccessService.requireAccess(user, groupId);
        if (name == null || name.isBlank()) {
            throw new BadRequestException("name parameter is required");
        }
        List<Animal> matches = animalRepository.findByGroupIdAndNameIgnoreCaseAndDeletedAtIsNull(groupId, name.trim());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", name.trim());
        body.put("count", matches.size());
        body.put("animals", matches);
        body.put("has_duplicates", matches.size() > 1);
        return body;
    }

    @Transactional
    public Animal createAnimal(AuthenticatedUser user, Long groupId, AnimalRequest request) {
        groupAccessService.requireAccess(user, groupId);
        requireGroup(groupId);
        String name = requireName(request.getName());

        AnimalStatus status = request.getStatus() == null || request.getStatus().isBlank()
                ? AnimalStatus.AVAILABLE
                : parseStatus(request.getStatus());
        Instant now = Instant.now();

        Animal animal = new Animal();
        animal.setGroupId(groupId);
        animal.setName(name);
        copyDescriptiveFields(animal, request);
        animal.setStatus(status);
        animal.setArrivalDate(now);
        animal.setLastStatusChange(now);

        switch (status) {
            case FOSTER -> animal.setFosterStartDate(now);
            case BITE_QUARANTINE -> animal.setQuarantineStartDate(
                    request.getQuarantineStartDate() != null ? request.getQuarantineStartDate() : now);
            case ARCHIVED -> animal.setArchivedDate(now);
            default -> {
            }
        }

        Animal saved = animalRepository.save(animal);
        log.info("Created animal {} ({}) in group {} with status {}", saved.getId(), name, groupId, status.getValue());
        return saved;
    }

    @Transactional
    public Animal updateAnimal(AuthenticatedUser user, Long groupId, Long animalId, AnimalRequest request) {
        groupAccessService.requireAccess(user, groupId);
        Animal animal = requireAnimal(groupId, animalId);
        String name = requireName(request.getName());

        applyStatusUpdate(animal, request);
        rename(animal, name, user.userId());
        copyDescriptiveFields(animal, request);
        if (request.getReturned() != null) {
            animal.setReturned(request.getReturned());
        }

        return animalRepository.save(animal);
    }

    @Transactional
    public void deleteAnimal(AuthenticatedUser user, Long groupId, Long animalId) {
        groupAccessService.requireModerator(user, groupId);
        Animal animal = requireAnimal(groupId, animalId);
        animal.setDeletedAt(Instant.now());
        animalRepository.save(animal);
        log.info("User {} deleted animal {} in group {}", user.userId(), animalId, groupId);
    }

    /**
     * Replace the animal's tags. Ids of tags from other groups are dropped silently.
     */
    @Transactional
    public Animal setTags(AuthenticatedUser user, Long groupId, Long animalId, List<Long> tagIds) {
        groupAccessService.requireAccess(user, groupId);
        Animal animal = requireAnimal(groupId, animalId);

        animal.getTags().clear();
        if (tagIds != null && !tagIds.isEmpty()) {
            animal.getTags().addAll(animalTagRepository.findByGroupIdAndIdIn(groupId, tagIds));
        }
        return animalRepository.save(animal);
    }

    @Transactional(readOnly = true)
    public List<AnimalNameHistory> nameHistory(AuthenticatedUser user, Long groupId, Long animalId) {
        groupAccessService.requireAccess(user, groupId);
        requireAnimal(groupId, animalId);
        return nameHistoryRepository.findByAnimalIdOrderByCreatedAtDesc(animalId);
    }

    // ==================== ADMIN / BULK ====================

    @Transactional(readOnly = true)
    public List<Animal> listAllAnimals(String status, Long groupId, String name) {
        Set<AnimalStatus> statuses = parseStatuses(status, EnumSet.allOf(AnimalStatus.class));
        if (groupId != null) {
            return animalRepository.searchInGroup(groupId, statuses, namePattern(name));
        }
        return animalRepository.searchAll(statuses, namePattern(name));
    }

    /**
     * Bulk-edit listing: site admins see every group, group admins the groups they administer.
     */
    @Transactional(readOnly = true)
    public List<Animal> listBulkAnimals(AuthenticatedUser user, String status, Long groupId, String name) {
        if (user.admin()) {
            return listAllAnimals(status, groupId, name);
        }
        Set<Long> administered = administeredGroupIds(user);
        if (administered.isEmpty()) {
            throw new ForbiddenException("Group admin access required");
        }
        if (groupId != null) {
            if (!administered.contains(groupId)) {
                throw new ForbiddenException("Group admin access required");
            }
            administered = Set.of(groupId);
        }
        return animalRepository.searchInGroups(administered,
                parseStatuses(status, EnumSet.allOf(AnimalStatus.class)), namePattern(name));
    }

    /**
     * Move animals to another group and/or change their status in one go.
     *
     * @return number of animals updated
     */
    @Transactional
    public int bulkUpdate(AuthenticatedUser user, BulkAnimalUpdateRequest request) {
        if (request.getAnimalIds() == null || request.getAnimalIds().isEmpty()) {
            throw new BadRequestException("No animal IDs provided");
        }
        boolean hasStatus = request.getStatus() != null && !request.getStatus().isBlank();
        if (request.getGroupId() == null && !hasStatus) {
            throw new BadRequestException("No updates provided");
        }
        AnimalStatus status = hasStatus ? parseStatus(request.getStatus()) : null;

        if (request.getGroupId() != null) {
            requireGroup(request.getGroupId());
        }

        List<Animal> animals = animalRepository.findByIdInAndDeletedAtIsNull(request.getAnimalIds());

        if (!user.admin()) {
            Set<Long> administered = administeredGroupIds(user);
            boolean allowed = animals.stream().allMatch(a -> administered.contains(a.getGroupId()))
                    && (request.getGroupId() == null || administered.contains(request.getGroupId()));
            if (!allowed) {
                throw new ForbiddenException("You can only update animals in groups you administer");
            }
        }

        Instant now = Instant.now();
        for (Animal animal : animals) {
            if (request.getGroupId() != null) {
                animal.setGroupId(request.getGroupId());
                // Tags are group scoped
                animal.getTags().clear();
            }
            if (status != null) {
                applyStatusChange(animal, status, null, now);
            }
        }
        animalRepository.saveAll(animals);

        log.info("User {} bulk updated {} animals (group_id={}, status={})",
                user.userId(), animals.size(), request.getGroupId(), request.getStatus());
        return animals.size();
    }

    /**
     * Site-admin edit of any animal. Only the fields present in the request are applied.
     */
    @Transactional
    public Animal adminUpdate(AuthenticatedUser admin, Long animalId, AnimalRequest request) {
        Animal animal = animalRepository.findByIdAndDeletedAtIsNull(animalId)
                .orElseThrow(() -> new NotFoundException("Animal not found"));

        applyStatusUpdate(animal, request);
        if (request.getName() != null && !request.getName().isBlank()) {
            rename(animal, request.getName().trim(), admin.userId());
        }
        if (request.getSpecies() != null) {
            animal.setSpecies(request.getSpecies());
        }
        if (request.getBreed() != null) {
            animal.setBreed(request.getBreed());
        }
        if (request.getAge() != null) {
            animal.setAge(request.getAge());
        }
        if (request.getEstimatedBirthDate() != null) {
            animal.setEstimatedBirthDate(request.getEstimatedBirthDate());
            animal.setAge(ageFromBirthDate(request.getEstimatedBirthDate()));
        }
        if (request.getDescription() != null) {
            animal.setDescription(request.getDescription());
        }
        if (request.getTrainerNotes() != null) {
            animal.setTrainerNotes(request.getTrainerNotes());
        }
        if (request.getImageUrl() != null) {
            animal.setImageUrl(request.getImageUrl());
        }
        if (request.getReturned() != null) {
            animal.setReturned(request.getReturned());
        }
        if (request.getGroupId() != null && !request.getGroupId().equals(animal.getGroupId())) {
            requireGroup(request.getGroupId());
            animal.setGroupId(request.getGroupId());
            animal.getTags().clear();
        }

        return animalRepository.save(animal);
    }

    // ==================== STATUS RULES ====================

    private void applyStatusUpdate(Animal animal, AnimalRequest request) {
        AnimalStatus requested = request.getStatus() == null || request.getStatus().isBlank()
                ? null
                : parseStatus(request.getStatus());

        if (requested != null && requested != animal.getStatus()) {
            applyStatusChange(animal, requested, request.getQuarantineStartDate(), Instant.now());
        } else if (request.getQuarantineStartDate() != null && animal.getStatus() == AnimalStatus.BITE_QUARANTINE) {
            animal.setQuarantineStartDate(request.getQuarantineStartDate());
        }
    }

    /**
     * Move the animal to {@code newStatus}, adjusting the per-status dates. No-op when the
     * status does not change.
     */
    static void applyStatusChange(Animal animal, AnimalStatus newStatus, Instant quarantineStart, Instant now) {
        AnimalStatus oldStatus = animal.getStatus();
        if (newStatus == oldStatus) {
            return;
        }

        switch (newStatus) {
            case AVAILABLE -> {
                if (oldStatus == AnimalStatus.ARCHIVED) {
                    animal.setReturnCount(animal.getReturnCount() + 1);
                    animal.setReturned(true);
                }
                animal.setFosterStartDate(null);
                animal.setQuarantineStartDate(null);
                animal.setArchivedDate(null);
            }
            case FOSTER -> {
                animal.setFosterStartDate(now);
                animal.setQuarantineStartDate(null);
                animal.setArchivedDate(null);
            }
            case BITE_QUARANTINE -> {
                animal.setQuarantineStartDate(quarantineStart != null ? quarantineStart : now);
                animal.setFosterStartDate(null);
                animal.setArchivedDate(null);
            }
            case ARCHIVED -> animal.setArchivedDate(now);
        }

        animal.setStatus(newStatus);
        animal.setLastStatusChange(now);
    }

    /**
     * Parse a status filter: blank means {@code defaults}, "all" means every status,
     * otherwise a comma-separated list.
     */
    static Set<AnimalStatus> parseStatuses(String raw, Set<AnimalStatus> defaults) {
        if (raw == null || raw.isBlank()) {
            return defaults;
        }
        if ("all".equalsIgnoreCase(raw.trim())) {
            return EnumSet.allOf(AnimalStatus.class);
        }
        Set<AnimalStatus> statuses = EnumSet.noneOf(AnimalStatus.class);
        for (String part : raw.split(",")) {
            if (!part.isBlank()) {
                statuses.add(parseStatus(part));
            }
        }
        return statuses.isEmpty() ? defaults : statuses;
    }

    static AnimalStatus parseStatus(String raw) {
        return AnimalStatus.parse(raw)
                .orElseThrow(() -> new BadRequestException("Invalid status '" + raw.trim() + "'"));
    }

    static String namePattern(String name) {
        return name == null || name.isBlank() ? "%%" : "%" + name.trim().toLowerCase() + "%";
    }

    static Integer ageFromBirthDate(LocalDate birthDate) {
        return AnimalTimeline.ageDisplay(birthDate, null, LocalDate.now(ZoneOffset.UTC)).years();
    }

    // ==================== HELPERS ====================

    private void copyDescriptiveFields(Animal animal, AnimalRequest request) {
        animal.setSpecies(request.getSpecies());
        animal.setBreed(request.getBreed());
        animal.setDescription(request.getDescription());
        animal.setTrainerNotes(request.getTrainerNotes());
        animal.setImageUrl(request.getImageUrl());
        animal.setEstimatedBirthDate(request.getEstimatedBirthDate());
        if (request.getEstimatedBirthDate() != null) {
            animal.setAge(ageFromBirthDate(request.getEstimatedBirthDate()));
        } else {
            animal.setAge(request.getAge());
        }
    }

    private void rename(Animal animal, String newName, Long changedBy) {
        String oldName = animal.getName();
        if (oldName != null && !oldName.equals(newName)) {
            AnimalNameHistory history = new AnimalNameHistory();
            history.setAnimalId(animal.getId());
            history.setOldName(oldName);
            history.setNewName(newName);
            history.setChangedBy(changedBy);
            nameHistoryRepository.save(history);
            log.info("Animal {} renamed from '{}' to '{}' by user {}", animal.getId(), oldName, newName, changedBy);
        }
        animal.setName(newName);
    }

    private Set<Long> administeredGroupIds(AuthenticatedUser user) {
        return groupRepository.findGroupsAdministeredBy(user.userId()).stream()
                .map(Group::getId)
                .collect(Collectors.toCollection(HashSet::new));
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new BadRequestException("Name is required");
        }
        return name.trim();
    }

    private Group requireGroup(Long groupId) {
        return groupRepository.findByIdAndDeletedAtIsNull(groupId)
                .orElseThrow(() -> new NotFoundException("Group not found"));
    }

    private Animal requireAnimal(Long groupId, Long animalId) {
        return animalRepository.findByIdAndGroupIdAndDeletedAtIsNull(animalId, groupId)
                .orElseThrow(() -> new NotFoundException("Animal not found"));
    }
}

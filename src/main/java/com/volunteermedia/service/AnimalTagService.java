package com.volunteermedia.service;

import com.volunteermedia.exception.BadRequestException;
import com.volunteermedia.exception.ConflictException;
import com.volunteermedia.exception.NotFoundException;
import com.volunteermedia.model.AnimalTag;
import com.volunteermedia.model.TagCategory;
import com.volunteermedia.repository.AnimalTagRepository;
import com.volunteermedia.security.AuthenticatedUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class AnimalTagService {

    private final AnimalTagRepository animalTagRepository;
    private final GroupAccessService groupAccessService;

    @Transactional(readOnly = true)
    public List<AnimalTag> listTags(AuthenticatedUser user, Long groupId) {
        groupAccessService.requireAccess(user, groupId);
        return animalTagRepository.findByGroupIdOrderByCategoryAscNameAsc(groupId);
    }

    @Transactional
    public AnimalTag createTag(AuthenticatedUser user, Long groupId, String name, String category, String color) {
        groupAccessService.requireModerator(user, groupId);
        String trimmed = validName(name);
        if (animalTagRepository.existsByGroupIdAndNameIgnoreCase(groupId, trimmed)) {
            throw new ConflictException("Tag name already exists in this group");
        }

        AnimalTag tag = new AnimalTag();
        tag.setGroupId(groupId);
        tag.setName(trimmed);
        tag.setCategory(parseCategory(category));
        tag.setColor(validColor(color));

        AnimalTag saved = animalTagRepository.save(tag);
        log.info("Created animal tag '{}' ({}) in group {}", trimmed, saved.getCategory().getValue(), groupId);
        return saved;
    }

    @Transactional
    public AnimalTag updateTag(AuthenticatedUser user, Long groupId, Long tagId,
                               String name, String category, String color) {
        groupAccessService.requireModerator(user, groupId);
        AnimalTag tag = requireTag(groupId, tagId);

        String trimmed = validName(name);
        if (animalTagRepository.existsByGroupIdAndNameIgnoreCaseAndIdNot(groupId, trimmed, tagId)) {
            throw new ConflictException("Tag name already exists in this group");
        }
        tag.setName(trimmed);
        tag.setCategory(parseCategory(category));
        tag.setColor(validColor(color));
        return animalTagRepository.save(tag);
    }

    /**
     * Removes the tag from every animal first.
     */
    @Transactional
    public void deleteTag(AuthenticatedUser user, Long groupId, Long tagId) {
        groupAccessService.requireModerator(user, groupId);
        AnimalTag tag = requireTag(groupId, tagId);
        animalTagRepository.detachFromAnimals(tag.getId());
        animalTagRepository.delete(tag);
        log.info("Deleted animal tag {} in group {}", tagId, groupId);
    }

    private AnimalTag requireTag(Long groupId, Long tagId) {
        return animalTagRepository.findByIdAndGroupId(tagId, groupId)
                .orElseThrow(() -> new NotFoundException("Tag not found"));
    }

    private static String validName(String name) {
        String trimmed = name == null ? "" : name.trim();
        if (trimmed.isEmpty() || trimmed.length() > 50) {
            throw new BadRequestException("Tag name must be between 1 and 50 characters");
        }
        return trimmed;
    }

    private static String validColor(String color) {
        if (color == null || color.isBlank()) {
            throw new BadRequestException("Color is required");
        }
        return color.trim();
    }

    private static TagCategory parseCategory(String category) {
        try {
            return TagCategory.fromValue(category);
        } catch (IllegalArgumentException e) {
            throw new BadRequestException("Category must be 'behavior' or 'walker_status'");
        }
    }
}

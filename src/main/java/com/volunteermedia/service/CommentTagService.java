package com.volunteermedia.service;

import com.volunteermedia.exception.BadRequestException;
import com.volunteermedia.exception.ConflictException;
import com.volunteermedia.exception.NotFoundException;
import com.volunteermedia.model.CommentTag;
import com.volunteermedia.repository.CommentTagRepository;
import com.volunteermedia.security.AuthenticatedUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Per-group comment tags. Every group carries the system tags "behavior" and "medical".
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CommentTagService {

    public static final Map<String, String> SYSTEM_TAGS;

    static {
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put("behavior", "#3b82f6");
        tags.put("medical", "#ef4444");
        SYSTEM_TAGS = Collections.unmodifiableMap(tags);
    }

    private static final Pattern HEX_COLOR = Pattern.compile("^#[0-9a-fA-F]{6}$");

    private final CommentTagRepository commentTagRepository;
    private final GroupAccessService groupAccessService;

    @Transactional(readOnly = true)
    public List<CommentTag> listTags(AuthenticatedUser user, Long groupId) {
        groupAccessService.requireAccess(user, groupId);
        return commentTagRepository.findByGroupIdAndDeletedAtIsNullOrderBySystemDescNameAsc(groupId);
    }

    @Transactional
    public CommentTag createTag(AuthenticatedUser user, Long groupId, String name, String color) {
        groupAccessService.requireModerator(user, groupId);

        String trimmed = name == null ? "" : name.trim();
        if (trimmed.isEmpty()) {
            throw new BadRequestException("Tag name is required");
        }
        if (trimmed.length() > 50) {
            throw new BadRequestException("Tag name must be 50 characters or less");
        }
        String tagColor = color == null || color.isBlank() ? CommentTag.DEFAULT_COLOR : color.trim();
        if (!HEX_COLOR.matcher(tagColor).matches()) {
            throw new BadRequestException("Color must be a hex color like #3b82f6");
        }

        CommentTag tag = commentTagRepository.findByGroupIdAndNameIgnoreCase(groupId, trimmed).orElse(null);
        if (tag != null && tag.getDeletedAt() == null) {
            throw new ConflictException("Tag already exists");
        }
        if (tag == null) {
            tag = new CommentTag(groupId, trimmed, tagColor, false);
        } else {
            // Revive the soft-deleted row with the same name
            tag.setDeletedAt(null);
            tag.setName(trimmed);
            tag.setColor(tagColor);
        }

        CommentTag saved = commentTagRepository.save(tag);
        log.info("Created comment tag '{}' in group {}", trimmed, groupId);
        return saved;
    }

    @Transactional
    public void deleteTag(AuthenticatedUser user, Long groupId, Long tagId) {
        groupAccessService.requireModerator(user, groupId);
        CommentTag tag = commentTagRepository.findByIdAndGroupIdAndDeletedAtIsNull(tagId, groupId)
                .orElseThrow(() -> new NotFoundException("Tag not found"));
        if (tag.isSystem()) {
            throw new BadRequestException("Cannot delete system tags");
        }
        tag.setDeletedAt(Instant.now());
        commentTagRepository.save(tag);
        log.info("Deleted comment tag {} in group {}", tagId, groupId);
    }

    /**
     * Create any missing system tags for the group.
     *
     * @return number of tags created
     */
    @Transactional
    public int ensureSystemTags(Long groupId) {
        int created = 0;
        for (Map.Entry<String, String> entry : SYSTEM_TAGS.entrySet()) {
            CommentTag tag = commentTagRepository.findByGroupIdAndNameIgnoreCase(groupId, entry.getKey()).orElse(null);
            if (tag == null) {
                commentTagRepository.save(new CommentTag(groupId, entry.getKey(), entry.getValue(), true));
                created++;
            } else if (!tag.isSystem() || tag.getDeletedAt() != null) {
                tag.setSystem(true);
                tag.setDeletedAt(null);
                commentTagRepository.save(tag);
            }
        }
        return created;
    }
}

package com.volunteermedia.service;

import com.volunteermedia.dto.CommentTagStatistics;
import com.volunteermedia.dto.GroupStatistics;
import com.volunteermedia.dto.UserStatistics;
import com.volunteermedia.model.AnimalStatus;
import com.volunteermedia.model.CommentTag;
import com.volunteermedia.model.Group;
import com.volunteermedia.model.User;
import com.volunteermedia.repository.AnimalCommentRepository;
import com.volunteermedia.repository.AnimalRepository;
import com.volunteermedia.repository.CommentTagRepository;
import com.volunteermedia.repository.GroupRepository;
import com.volunteermedia.repository.UserGroupRepository;
import com.volunteermedia.repository.UserRepository;
import com.volunteermedia.security.AuthenticatedUser;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-only counts for the admin dashboard and the statistics pages.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class StatisticsService {

    static final Duration RECENT_WINDOW = Duration.ofDays(7);

    private final UserRepository userRepository;
    private final GroupRepository groupRepository;
    private final UserGroupRepository userGroupRepository;
    private final AnimalRepository animalRepository;
    private final AnimalCommentRepository commentRepository;
    private final CommentTagRepository commentTagRepository;
    private final GroupAccessService groupAccessService;

    public Map<String, Object> dashboardStats() {
        Map<String, Long> byStatus = new LinkedHashMap<>();
        long totalAnimals = 0;
        for (AnimalStatus status : AnimalStatus.values()) {
            long count = animalRepository.countByStatusAndDeletedAtIsNull(status);
            byStatus.put(status.getValue(), count);
            totalAnimals += count;
        }

        List<Map<String, Object>> recentUsers = userRepository.findTop5ByDeletedAtIsNullOrderByCreatedAtDesc().stream()
                .map(StatisticsService::recentUser)
                .collect(Collectors.toList());

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("total_users", userRepository.countByDeletedAtIsNull());
        stats.put("total_admins", userRepository.countByAdminTrueAndDeletedAtIsNull());
        stats.put("total_groups", groupRepository.countByDeletedAtIsNull());
        stats.put("total_animals", totalAnimals);
        stats.put("animals_by_status", byStatus);
        stats.put("total_comments", commentRepository.countByDeletedAtIsNull());
        stats.put("comments_last_7_days",
                commentRepository.countByDeletedAtIsNullAndCreatedAtAfter(Instant.now().minus(RECENT_WINDOW)));
        stats.put("recent_users", recentUsers);
        return stats;
    }

    public List<GroupStatistics> groupStatistics() {
        Map<Long, AnimalCommentRepository.GroupActivity> activity = commentRepository.summarizeByGroup().stream()
                .collect(Collectors.toMap(AnimalCommentRepository.GroupActivity::getGroupId, Function.identity()));

        return groupRepository.findByDeletedAtIsNullOrderByNameAsc().stream()
                .map(group -> toGroupStatistics(group, activity.get(group.getId())))
                .collect(Collectors.toList());
    }

    public List<UserStatistics> userStatistics() {
        Map<Long, AnimalCommentRepository.UserActivity> activity = commentRepository.summarizeByUser().stream()
                .collect(Collectors.toMap(AnimalCommentRepository.UserActivity::getUserId, Function.identity()));

        return userRepository.findByDeletedAtIsNullOrderByUsernameAsc().stream()
                .map(user -> {
                    AnimalCommentRepository.UserActivity a = activity.get(user.getId());
                    return new UserStatistics(user.getId(), user.getUsername(),
                            a != null ? a.getCommentCount() : 0,
                            a != null ? a.getLastActive() : null,
                            a != null ? a.getAnimalsInteracted() : 0);
                })
                .collect(Collectors.toList());
    }

    public List<CommentTagStatistics> commentTagStatistics(AuthenticatedUser user, Long groupId) {
        groupAccessService.requireAccess(user, groupId);

        Map<Long, AnimalCommentRepository.TagUsage> usage = commentRepository.summarizeTagUsage(groupId).stream()
                .collect(Collectors.toMap(AnimalCommentRepository.TagUsage::getTagId, Function.identity()));

        List<CommentTag> tags = commentTagRepository.findByGroupIdAndDeletedAtIsNullOrderBySystemDescNameAsc(groupId);
        return tags.stream()
                .map(tag -> {
                    AnimalCommentRepository.TagUsage u = usage.get(tag.getId());
                    return new CommentTagStatistics(tag.getId(), tag.getName(), tag.getColor(),
                            u != null ? u.getCommentCount() : 0,
                            u != null ? u.getLastUsed() : null);
                })
                .collect(Collectors.toList());
    }

    private GroupStatistics toGroupStatistics(Group group, AnimalCommentRepository.GroupActivity activity) {
        return new GroupStatistics(
                group.getId(),
                group.getName(),
                userGroupRepository.countActiveMembers(group.getId()),
                animalRepository.countByGroupIdAndDeletedAtIsNull(group.getId()),
                activity != null ? activity.getCommentCount() : 0,
                activity != null ? activity.getLastActivity() : null);
    }

    private static Map<String, Object> recentUser(User user) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", user.getId());
        view.put("username", user.getUsername());
        view.put("email", user.getEmail());
        view.put("is_admin", user.isAdmin());
        view.put("created_at", user.getCreatedAt());
        return view;
    }
}

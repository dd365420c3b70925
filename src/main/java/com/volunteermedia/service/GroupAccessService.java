package com.volunteermedia.service;

import com.volunteermedia.exception.ForbiddenException;
import com.volunteermedia.model.UserGroup;
import com.volunteermedia.repository.UserGroupRepository;
import com.volunteermedia.security.AuthenticatedUser;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Group-level authorization.
 *
 * Site admins pass every check. Otherwise "access" means membership in the group and
 * "moderate" means membership with the group-admin flag.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class GroupAccessService {

    private final UserGroupRepository userGroupRepository;

    public boolean isMember(Long userId, Long groupId) {
        return userGroupRepository.existsByUserIdAndGroupId(userId, groupId);
    }

    public boolean isGroupAdmin(Long userId, Long groupId) {
        return userGroupRepository.findByUserIdAndGroupId(userId, groupId)
                .map(UserGroup::isGroupAdmin)
                .orElse(false);
    }

    public boolean canAccess(AuthenticatedUser user, Long groupId) {
        return user.admin() || isMember(user.userId(), groupId);
    }

    public boolean canModerate(AuthenticatedUser user, Long groupId) {
        return user.admin() || isGroupAdmin(user.userId(), groupId);
    }

    public void requireAccess(AuthenticatedUser user, Long groupId) {
        if (!canAccess(user, groupId)) {
            throw new ForbiddenException("Access denied");
        }
    }

    public void requireModerator(AuthenticatedUser user, Long groupId) {
        if (!canModerate(user, groupId)) {
            throw new ForbiddenException("Group admin access required");
        }
    }
}

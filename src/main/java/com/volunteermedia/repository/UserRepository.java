package com.volunteermedia.repository;

import com.volunteermedia.model.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for user accounts.
 *
 * Soft-deleted users are excluded explicitly (the {@code DeletedAtIsNull} finders) so that
 * their comments and images still resolve the author.
 */
@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    Optional<User> findByIdAndDeletedAtIsNull(Long id);

    Optional<User> findByUsernameIgnoreCaseAndDeletedAtIsNull(String username);

    Optional<User> findByEmailIgnoreCaseAndDeletedAtIsNull(String email);

    List<User> findByDeletedAtIsNullOrderByUsernameAsc();

    List<User> findByDeletedAtIsNotNullOrderByDeletedAtDesc();

    boolean existsByUsernameIgnoreCase(String username);

    boolean existsByEmailIgnoreCase(String email);

    boolean existsByEmailIgnoreCaseAndIdNot(String email, Long id);

    /**
     * Candidates for a reset token: the 16-char lookup prefix narrows the search,
     * the BCrypt hash comparison decides.
     */
    List<User> findByResetTokenLookupAndDeletedAtIsNull(String resetTokenLookup);

    List<User> findBySetupTokenLookupAndDeletedAtIsNull(String setupTokenLookup);

    List<User> findByEmailNotificationsEnabledTrueAndDeletedAtIsNull();

    @Query("SELECT u FROM User u WHERE u.deletedAt IS NULL AND u.emailNotificationsEnabled = true " +
           "AND u.id IN (SELECT ug.userId FROM UserGroup ug WHERE ug.groupId = :groupId)")
    List<User> findNotificationRecipientsInGroup(Long groupId);

    long countByDeletedAtIsNull();

    long countByAdminTrueAndDeletedAtIsNull();

    List<User> findTop5ByDeletedAtIsNullOrderByCreatedAtDesc();
}

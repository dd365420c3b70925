package com.volunteermedia.service;

import com.volunteermedia.exception.ConflictException;
import com.volunteermedia.model.Animal;
import com.volunteermedia.model.AnimalComment;
import com.volunteermedia.model.AnimalStatus;
import com.volunteermedia.model.CommentTag;
import com.volunteermedia.model.Group;
import com.volunteermedia.model.SessionMetadata;
import com.volunteermedia.model.User;
import com.volunteermedia.model.UserGroup;
import com.volunteermedia.repository.AnimalCommentRepository;
import com.volunteermedia.repository.AnimalRepository;
import com.volunteermedia.repository.CommentTagRepository;
import com.volunteermedia.repository.GroupRepository;
import com.volunteermedia.repository.UserGroupRepository;
import com.volunteermedia.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Default rows every installation needs, and demo data for development databases.
 *
 * DEFAULTS (startup, idempotent):
 * ===============================
 * - groups dogs, cats, modsquad
 * - system comment tags in each of them
 * - site settings
 *
 * DEMO DATA (admin request):
 * ==========================
 * ModSquad volunteers, animals in every status and a few session reports. Rows that already
 * exist (same username, same animal name in the group) are left alone, so seeding twice
 * does not duplicate anything.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SeedService {

    public static final String MODSQUAD = "modsquad";
    static final String DEMO_PASSWORD = "volunteer2026!";
    static final String DEMO_GROUP_ADMIN = "sarah_modsquad";
    static final List<String> DEMO_VOLUNTEERS = List.of(DEMO_GROUP_ADMIN, "mike_modsquad", "jake_modsquad", "lisa_modsquad");

    static final Map<String, String> DEFAULT_GROUPS;

    static {
        Map<String, String> groups = new LinkedHashMap<>();
        groups.put("dogs", "Dog volunteers group");
        groups.put("cats", "Cat volunteers group");
        groups.put(MODSQUAD, "Moderators group");
        DEFAULT_GROUPS = groups;
    }

    private final GroupRepository groupRepository;
    private final UserRepository userRepository;
    private final UserGroupRepository userGroupRepository;
    private final AnimalRepository animalRepository;
    private final AnimalCommentRepository commentRepository;
    private final CommentTagRepository commentTagRepository;
    private final CommentTagService commentTagService;
    private final SiteSettingService siteSettingService;
    private final AuthService authService;

    @Transactional
    public void ensureDefaults() {
        int groupsCreated = 0;
        int tagsCreated = 0;
        for (Map.Entry<String, String> entry : DEFAULT_GROUPS.entrySet()) {
            Group group = groupRepository.findByNameIgnoreCase(entry.getKey()).orElse(null);
            if (group == null) {
                group = new Group();
                group.setName(entry.getKey());
                group.setDescription(entry.getValue());
                group = groupRepository.save(group);
                groupsCreated++;
            }
            tagsCreated += commentTagService.ensureSystemTags(group.getId());
        }
        int settingsCreated = siteSettingService.ensureDefaults();

        if (groupsCreated + tagsCreated + settingsCreated > 0) {
            log.info("Default data ensured: {} groups, {} comment tags, {} settings created",
                    groupsCreated, tagsCreated, settingsCreated);
        }
    }

    /**
     * Seed demo data. Refuses when other users already exist unless {@code force} is set.
     */
    @Transactional
    public Map<String, Object> seedDemoData(Long callerId, boolean force) {
        long otherUsers = userRepository.countByDeletedAtIsNull() - 1;
        if (otherUsers > 0 && !force) {
            throw new ConflictException("Database already contains users. Set force to seed anyway.");
        }

        ensureDefaults();
        Group modsquad = groupRepository.findByNameIgnoreCase(MODSQUAD)
                .orElseThrow(() -> new IllegalStateException("modsquad group missing after defaults"));

        List<User> volunteers = seedVolunteers(modsquad);
        List<Animal> animals = seedAnimals(modsquad);
        int comments = seedComments(modsquad, volunteers, animals);

        log.warn("Admin {} seeded demo data: {} volunteers, {} animals, {} comments (force={})",
                callerId, volunteers.size(), animals.size(), comments, force);

        Map<String, Object> accounts = new LinkedHashMap<>();
        accounts.put("volunteers", DEMO_VOLUNTEERS);
        accounts.put("password", DEMO_PASSWORD);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Database seeded successfully");
        body.put("demo_accounts", accounts);
        body.put("animals", animals.size());
        body.put("comments", comments);
        return body;
    }

    private List<User> seedVolunteers(Group modsquad) {
        String passwordHash = authService.hashPassword(DEMO_PASSWORD);
        List<User> users = new ArrayList<>();
        for (String username : DEMO_VOLUNTEERS) {
            User user = userRepository.findByUsernameIgnoreCaseAndDeletedAtIsNull(username).orElse(null);
            if (user == null) {
                String first = username.substring(0, 1).toUpperCase() + username.substring(1, username.indexOf('_'));
                user = new User();
                user.setUsername(username);
                user.setEmail(username + "@demo.local");
                user.setFirstName(first);
                user.setLastName("ModSquad");
                user.setPassword(passwordHash);
                user.setDefaultGroupId(modsquad.getId());
                user = userRepository.save(user);
            }
            if (!userGroupRepository.existsByUserIdAndGroupId(user.getId(), modsquad.getId())) {
                userGroupRepository.save(new UserGroup(user.getId(), modsquad.getId(), DEMO_GROUP_ADMIN.equals(username)));
            }
            users.add(user);
        }
        return users;
    }

    private List<Animal> seedAnimals(Group modsquad) {
        Instant now = Instant.now();
        Object[][] demo = {
                {"Buddy", "Golden Retriever", 3, AnimalStatus.AVAILABLE, 180,
                        "Friendly golden who loves every person he meets."},
                {"Luna", "German Shepherd", 2, AnimalStatus.FOSTER, 90,
                        "Smart and sensitive, needs an experienced handler."},
                {"Rocky", "Pit Bull Mix", 4, AnimalStatus.BITE_QUARANTINE, 200,
                        "Working on handling sensitivity with the behavior team."},
                {"Daisy", "Border Collie", 1, AnimalStatus.AVAILABLE, 14,
                        "Eager to learn, needs a job to do."},
                {"Zeus", "Great Dane", 5, AnimalStatus.ARCHIVED, 120,
                        "Gentle giant, adopted."},
        };

        List<Animal> animals = new ArrayList<>();
        for (Object[] row : demo) {
            String name = (String) row[0];
            List<Animal> existing = animalRepository.findByGroupIdAndNameIgnoreCaseAndDeletedAtIsNull(modsquad.getId(), name);
            if (!existing.isEmpty()) {
                animals.add(existing.get(0));
                continue;
            }
            Instant arrival = now.minus(Duration.ofDays((Integer) row[4]));
            Animal animal = new Animal();
            animal.setGroupId(modsquad.getId());
            animal.setName(name);
            animal.setSpecies("Dog");
            animal.setBreed((String) row[1]);
            animal.setAge((Integer) row[2]);
            animal.setDescription((String) row[5]);
            animal.setArrivalDate(arrival);
            animal.setLastStatusChange(arrival);
            AnimalService.applyStatusChange(animal, (AnimalStatus) row[3], null, now.minus(Duration.ofDays(3)));
            animals.add(animalRepository.save(animal));
        }
        return animals;
    }

    private int seedComments(Group modsquad, List<User> volunteers, List<Animal> animals) {
        CommentTag behavior = commentTagRepository.findByGroupIdAndNameIgnoreCaseAndDeletedAtIsNull(modsquad.getId(), "behavior")
                .orElse(null);

        int created = 0;
        for (int i = 0; i < animals.size(); i++) {
            Animal animal = animals.get(i);
            if (commentRepository.findActiveByAnimal(animal.getId(), Pageable.ofSize(1))
                    .getTotalElements() > 0) {
                continue;
            }
            User author = volunteers.get(i % volunteers.size());

            AnimalComment note = new AnimalComment();
            note.setAnimalId(animal.getId());
            note.setUserId(author.getId());
            note.setContent("Session with " + animal.getName() + " went well overall.");
            note.setMetadata(SessionMetadata.builder()
                    .sessionGoal("Loose-leash walking")
                    .sessionOutcome(animal.getName() + " settled after the first ten minutes.")
                    .behaviorNotes(i % 2 == 0 ? "Pulled toward other dogs at the start." : null)
                    .sessionRating(5 - (i % 5))
                    .sessionStartTime("09:00")
                    .sessionEndTime("09:45")
                    .build());
            if (behavior != null && i % 2 == 0) {
                note.getTags().add(behavior);
            }
            commentRepository.save(note);
            created++;
        }
        return created;
    }
}

package com.volunteermedia.repository;

import com.volunteermedia.model.AnimalImage;
import com.volunteermedia.model.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class AnimalImageRepositoryTest {

    @Autowired
    private AnimalImageRepository animalImageRepository;
    @Autowired
    private UserRepository userRepository;

    private Long uploaderId;

    @BeforeEach
    void setUp() {
        User uploader = new User();
        uploader.setUsername("casey");
        uploader.setEmail("casey@example.org");
        uploader.setPassword("$2a$10$hash");
        uploaderId = userRepository.save(uploader).getId();
    }

    private AnimalImage image(Long animalId, String file, boolean profile) {
        AnimalImage image = new AnimalImage();
        image.setAnimalId(animalId);
        image.setUserId(uploaderId);
        image.setFileId(file);
        image.setImageUrl("/api/images/" + file);
        image.setProfilePicture(profile);
        return image;
    }

    @Test
    void galleryListsProfilePictureFirstThenNewest() {
        AnimalImage profile = animalImageRepository.save(image(4L, "profile", true));
        AnimalImage older = animalImageRepository.save(image(4L, "older", false));
        AnimalImage newer = animalImageRepository.save(image(4L, "newer", false));
        AnimalImage removed = animalImageRepository.save(image(4L, "removed", false));
        animalImageRepository.save(image(5L, "other-animal", false));

        profile.setCreatedAt(Instant.parse("2026-01-01T00:00:00Z"));
        older.setCreatedAt(Instant.parse("2026-02-01T00:00:00Z"));
        newer.setCreatedAt(Instant.parse("2026-03-01T00:00:00Z"));
        removed.setCreatedAt(Instant.parse("2026-04-01T00:00:00Z"));
        removed.setDeletedAt(Instant.parse("2026-04-02T00:00:00Z"));
        animalImageRepository.saveAllAndFlush(List.of(profile, older, newer, removed));

        List<AnimalImage> gallery = animalImageRepository
                .findByAnimalIdAndDeletedAtIsNullOrderByProfilePictureDescCreatedAtDesc(4L);

        assertThat(gallery).extracting(AnimalImage::getFileId).containsExactly("profile", "newer", "older");
    }

    @Test
    void findsCurrentProfilePictures() {
        animalImageRepository.saveAll(List.of(
                image(4L, "profile", true),
                image(4L, "plain", false),
                image(5L, "other-profile", true)));

        assertThat(animalImageRepository.findByAnimalIdAndProfilePictureTrueAndDeletedAtIsNull(4L))
                .extracting(AnimalImage::getFileId)
                .containsExactly("profile");
    }
}

package com.volunteermedia.service;

import com.volunteermedia.exception.BadRequestException;
import com.volunteermedia.exception.ForbiddenException;
import com.volunteermedia.model.Animal;
import com.volunteermedia.model.AnimalImage;
import com.volunteermedia.model.StoredFile;
import com.volunteermedia.repository.AnimalImageRepository;
import com.volunteermedia.repository.AnimalRepository;
import com.volunteermedia.repository.StoredFileRepository;
import com.volunteermedia.security.AuthenticatedUser;
import com.volunteermedia.upload.ImageProcessor;
import com.volunteermedia.upload.ProcessedImage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ImageServiceTest {

    private static final AuthenticatedUser VOLUNTEER = new AuthenticatedUser(8L, false);
    private static final byte[] JPEG = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, (byte) 0xE0, 0, 0x10};

    @Mock
    private StoredFileRepository storedFileRepository;
    @Mock
    private AnimalImageRepository animalImageRepository;
    @Mock
    private AnimalRepository animalRepository;
    @Mock
    private ImageProcessor imageProcessor;
    @Mock
    private GroupAccessService groupAccessService;

    @InjectMocks
    private ImageService imageService;

    private Animal animal;

    @BeforeEach
    void setUp() {
        animal = new Animal();
        animal.setId(4L);
        animal.setGroupId(2L);
        animal.setName("Rex");
    }

    private static AnimalImage image(long id, long userId, boolean profile) {
        AnimalImage image = new AnimalImage();
        image.setId(id);
        image.setAnimalId(4L);
        image.setUserId(userId);
        image.setImageUrl("/api/images/file-" + id);
        image.setProfilePicture(profile);
        return image;
    }

    @Test
    void setProfilePictureMovesTheFlagAndUpdatesTheAnimal() {
        AnimalImage previous = image(1L, 3L, true);
        AnimalImage chosen = image(2L, 8L, false);
        when(animalRepository.findByIdAndGroupIdAndDeletedAtIsNull(4L, 2L)).thenReturn(Optional.of(animal));
        when(animalImageRepository.findByIdAndAnimalIdAndDeletedAtIsNull(2L, 4L)).thenReturn(Optional.of(chosen));
        when(animalImageRepository.findByAnimalIdAndProfilePictureTrueAndDeletedAtIsNull(4L))
                .thenReturn(List.of(previous));

        Map<String, Object> body = imageService.setProfilePicture(VOLUNTEER, 2L, 4L, 2L);

        assertThat(previous.isProfilePicture()).isFalse();
        assertThat(chosen.isProfilePicture()).isTrue();
        assertThat(animal.getImageUrl()).isEqualTo("/api/images/file-2");
        assertThat(body).containsEntry("message", "Profile picture updated successfully")
                .containsEntry("image_url", "/api/images/file-2");
        verify(animalImageRepository).saveAll(List.of(previous));
        verify(animalRepository).save(animal);
    }

    @Test
    void galleryUsesProfileFirstOrdering() {
        List<AnimalImage> ordered = List.of(image(5L, 3L, true), image(9L, 8L, false));
        when(animalRepository.findByIdAndGroupIdAndDeletedAtIsNull(4L, 2L)).thenReturn(Optional.of(animal));
        when(animalImageRepository.findByAnimalIdAndDeletedAtIsNullOrderByProfilePictureDescCreatedAtDesc(4L))
                .thenReturn(ordered);

        assertThat(imageService.listImages(VOLUNTEER, 2L, 4L)).extracting(AnimalImage::getId).containsExactly(5L, 9L);
        verify(groupAccessService).requireAccess(VOLUNTEER, 2L);
    }

    @Test
    void profilePictureCannotBeDeleted() {
        when(animalRepository.findByIdAndGroupIdAndDeletedAtIsNull(4L, 2L)).thenReturn(Optional.of(animal));
        when(animalImageRepository.findByIdAndAnimalIdAndDeletedAtIsNull(1L, 4L))
                .thenReturn(Optional.of(image(1L, 8L, true)));

        assertThatThrownBy(() -> imageService.deleteImage(VOLUNTEER, 2L, 4L, 1L))
                .isInstanceOf(BadRequestException.class)
                .hasMessage("Cannot delete profile picture. Please set a different profile picture first.");
        verify(animalImageRepository, never()).save(any());
    }

    @Test
    void volunteersOnlyDeleteTheirOwnImages() {
        when(animalRepository.findByIdAndGroupIdAndDeletedAtIsNull(4L, 2L)).thenReturn(Optional.of(animal));
        when(animalImageRepository.findByIdAndAnimalIdAndDeletedAtIsNull(3L, 4L))
                .thenReturn(Optional.of(image(3L, 99L, false)));
        when(groupAccessService.canModerate(VOLUNTEER, 2L)).thenReturn(false);

        assertThatThrownBy(() -> imageService.deleteImage(VOLUNTEER, 2L, 4L, 3L))
                .isInstanceOf(ForbiddenException.class)
                .hasMessage("You can only delete your own images");
    }

    @Test
    void ownImageIsSoftDeleted() {
        AnimalImage own = image(3L, 8L, false);
        when(animalRepository.findByIdAndGroupIdAndDeletedAtIsNull(4L, 2L)).thenReturn(Optional.of(animal));
        when(animalImageRepository.findByIdAndAnimalIdAndDeletedAtIsNull(3L, 4L)).thenReturn(Optional.of(own));

        imageService.deleteImage(VOLUNTEER, 2L, 4L, 3L);

        assertThat(own.getDeletedAt()).isNotNull();
        verify(animalImageRepository).save(own);
    }

    @Test
    void uploadWithForgedExtensionIsRejected() {
        MockMultipartFile upload = new MockMultipartFile("image", "dog.jpg", "image/jpeg",
                "<script>alert(1)</script>".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> imageService.uploadImage(upload))
                .isInstanceOf(BadRequestException.class)
                .hasMessage("file does not appear to be a valid image");
        verifyNoInteractions(imageProcessor, storedFileRepository);
    }

    @Test
    void galleryUploadRecordsProcessedImage() {
        byte[] processed = {1, 2, 3, 4};
        when(animalRepository.findByIdAndGroupIdAndDeletedAtIsNull(4L, 2L)).thenReturn(Optional.of(animal));
        when(imageProcessor.process(JPEG, "image/jpeg")).thenReturn(new ProcessedImage(processed, "image/jpeg", 800, 600));
        when(animalImageRepository.save(any(AnimalImage.class))).thenAnswer(inv -> inv.getArgument(0));

        AnimalImage saved = imageService.uploadToGallery(VOLUNTEER, 2L, 4L,
                new MockMultipartFile("image", "rex.jpg", "image/jpeg", JPEG), "  Rex at the park ");

        ArgumentCaptor<StoredFile> stored = ArgumentCaptor.forClass(StoredFile.class);
        verify(storedFileRepository).save(stored.capture());
        assertThat(stored.getValue().getKind()).isEqualTo(StoredFile.Kind.IMAGE);
        assertThat(saved.getImageUrl()).isEqualTo("/api/images/" + stored.getValue().getId());
        assertThat(saved.getCaption()).isEqualTo("Rex at the park");
        assertThat(saved.getWidth()).isEqualTo(800);
        assertThat(saved.getFileSize()).isEqualTo(4L);
        assertThat(saved.getUserId()).isEqualTo(8L);
    }
}

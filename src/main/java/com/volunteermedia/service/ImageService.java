package com.volunteermedia.service;

import com.volunteermedia.exception.BadRequestException;
import com.volunteermedia.exception.ForbiddenException;
import com.volunteermedia.exception.NotFoundException;
import com.volunteermedia.model.Animal;
import com.volunteermedia.model.AnimalImage;
import com.volunteermedia.model.StoredFile;
import com.volunteermedia.repository.AnimalImageRepository;
import com.volunteermedia.repository.AnimalRepository;
import com.volunteermedia.repository.StoredFileRepository;
import com.volunteermedia.security.AuthenticatedUser;
import com.volunteermedia.upload.ImageProcessor;
import com.volunteermedia.upload.ProcessedImage;
import com.volunteermedia.upload.UploadValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Image uploads, storage and the per-animal photo gallery.
 *
 * STORAGE:
 * ========
 * Processed bytes live in stored_files (kind IMAGE) and are served from /api/images/{uuid}.
 * Gallery rows (animal_images) point at the stored file and carry caption, size and the
 * profile-picture flag. Stand-alone uploads (group images, hero images, protocol images,
 * pictures picked in the animal form) only create the stored file.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ImageService {

    public static final String IMAGE_URL_PREFIX = "/api/images/";

    private final StoredFileRepository storedFileRepository;
    private final AnimalImageRepository animalImageRepository;
    private final AnimalRepository animalRepository;
    private final ImageProcessor imageProcessor;
    private final GroupAccessService groupAccessService;

    /**
     * An image that has been validated, processed and saved.
     */
    public record StoredImage(String fileId, String url, ProcessedImage image) {
    }

    // ==================== STAND-ALONE UPLOADS ====================

    @Transactional
    public StoredImage storeImage(MultipartFile file, long maxSize) {
        byte[] bytes = readBytes(file);
        String detectedType = UploadValidator.validateImage(file.getOriginalFilename(), bytes, maxSize);
        ProcessedImage processed = imageProcessor.process(bytes, detectedType);

        StoredFile stored = new StoredFile();
        stored.setId(UUID.randomUUID().toString());
        stored.setKind(StoredFile.Kind.IMAGE);
        stored.setContentType(processed.contentType());
        stored.setFileName(UploadValidator.sanitizeFileName(file.getOriginalFilename()));
        stored.setData(processed.data());
        stored.setSize(processed.data().length);
        storedFileRepository.save(stored);

        log.info("Stored image {} ({} bytes, {}x{}, {})", stored.getId(), stored.getSize(),
                processed.width(), processed.height(), processed.contentType());
        return new StoredImage(stored.getId(), IMAGE_URL_PREFIX + stored.getId(), processed);
    }

    @Transactional
    public String uploadImage(MultipartFile file) {
        return storeImage(file, UploadValidator.MAX_IMAGE_SIZE).url();
    }

    @Transactional
    public String uploadHeroImage(MultipartFile file) {
        return storeImage(file, UploadValidator.MAX_HERO_IMAGE_SIZE).url();
    }

    @Transactional
    public String uploadProtocolImage(AuthenticatedUser user, Long groupId, MultipartFile file) {
        groupAccessService.requireModerator(user, groupId);
        return storeImage(file, UploadValidator.MAX_IMAGE_SIZE).url();
    }

    @Transactional(readOnly = true)
    public StoredFile getImage(String id) {
        return storedFileRepository.findByIdAndKind(id, StoredFile.Kind.IMAGE)
                .orElseThrow(() -> new NotFoundException("Image not found"));
    }

    // ==================== GALLERY ====================

    @Transactional(readOnly = true)
    public List<AnimalImage> listImages(AuthenticatedUser user, Long groupId, Long animalId) {
        groupAccessService.requireAccess(user, groupId);
        requireAnimal(groupId, animalId);
        return animalImageRepository.findByAnimalIdAndDeletedAtIsNullOrderByProfilePictureDescCreatedAtDesc(animalId);
    }

    @Transactional
    public AnimalImage uploadToGallery(AuthenticatedUser user, Long groupId, Long animalId,
                                       MultipartFile file, String caption) {
        groupAccessService.requireAccess(user, groupId);
        requireAnimal(groupId, animalId);

        StoredImage stored = storeImage(file, UploadValidator.MAX_IMAGE_SIZE);

        AnimalImage image = new AnimalImage();
        image.setAnimalId(animalId);
        image.setUserId(user.userId());
        image.setImageUrl(stored.url());
        image.setFileId(stored.fileId());
        image.setMimeType(stored.image().contentType());
        image.setCaption(caption == null ? null : caption.trim());
        image.setWidth(stored.image().width());
        image.setHeight(stored.image().height());
        image.setFileSize(stored.image().data().length);

        AnimalImage saved = animalImageRepository.save(image);
        log.info("User {} added image {} to animal {}", user.userId(), saved.getId(), animalId);
        return saved;
    }

    @Transactional
    public void deleteImage(AuthenticatedUser user, Long groupId, Long animalId, Long imageId) {
        groupAccessService.requireAccess(user, groupId);
        requireAnimal(groupId, animalId);
        AnimalImage image = requireImage(animalId, imageId);

        if (!image.getUserId().equals(user.userId()) && !groupAccessService.canModerate(user, groupId)) {
            throw new ForbiddenException("You can only delete your own images");
        }
        if (image.isProfilePicture()) {
            throw new BadRequestException("Cannot delete profile picture. Please set a different profile picture first.");
        }

        image.setDeletedAt(Instant.now());
        animalImageRepository.save(image);
        log.info("User {} deleted image {} of animal {}", user.userId(), imageId, animalId);
    }

    @Transactional
    public Map<String, Object> setProfilePicture(AuthenticatedUser user, Long groupId, Long animalId, Long imageId) {
        groupAccessService.requireAccess(user, groupId);
        Animal animal = requireAnimal(groupId, animalId);
        AnimalImage image = requireImage(animalId, imageId);

        List<AnimalImage> current = animalImageRepository.findByAnimalIdAndProfilePictureTrueAndDeletedAtIsNull(animalId);
        current.forEach(i -> i.setProfilePicture(false));
        animalImageRepository.saveAll(current);

        image.setProfilePicture(true);
        animalImageRepository.save(image);

        animal.setImageUrl(image.getImageUrl());
        animalRepository.save(animal);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Profile picture updated successfully");
        body.put("image_url", image.getImageUrl());
        return body;
    }

    @Transactional(readOnly = true)
    public List<AnimalImage> deletedImages(AuthenticatedUser user, Long groupId) {
        groupAccessService.requireModerator(user, groupId);
        return animalImageRepository.findDeletedInGroup(groupId);
    }

    @Transactional(readOnly = true)
    public List<AnimalImage> allDeletedImages() {
        return animalImageRepository.findByDeletedAtIsNotNullOrderByDeletedAtDesc();
    }

    // ==================== HELPERS ====================

    static byte[] readBytes(MultipartFile file) {
        if (file == null) {
            throw new BadRequestException("No file uploaded");
        }
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read uploaded file", e);
        }
    }

    private Animal requireAnimal(Long groupId, Long animalId) {
        return animalRepository.findByIdAndGroupIdAndDeletedAtIsNull(animalId, groupId)
                .orElseThrow(() -> new NotFoundException("Animal not found"));
    }

    private AnimalImage requireImage(Long animalId, Long imageId) {
        return animalImageRepository.findByIdAndAnimalIdAndDeletedAtIsNull(imageId, animalId)
                .orElseThrow(() -> new NotFoundException("Image not found"));
    }
}

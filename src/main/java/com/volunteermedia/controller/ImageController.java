package com.volunteermedia.controller;

import com.volunteermedia.model.AnimalImage;
import com.volunteermedia.model.StoredFile;
import com.volunteermedia.security.AuthenticatedUser;
import com.volunteermedia.security.CurrentUser;
import com.volunteermedia.service.ImageService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * IMAGES
 * ======
 *
 * Uploads are validated against their magic bytes, scaled down and re-encoded as JPEG where
 * the format can be decoded, then stored in the database. {@code GET /api/images/{id}} is
 * public so that plain &lt;img&gt; tags work; the ids are random UUIDs.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ImageController {

    private static final CacheControl IMMUTABLE = CacheControl.maxAge(Duration.ofDays(365)).cachePublic().immutable();

    private final ImageService imageService;

    @PostMapping("/animals/upload-image")
    public ResponseEntity<Map<String, String>> uploadImage(@RequestParam("image") MultipartFile image) {
        return ResponseEntity.ok(Map.of("url", imageService.uploadImage(image)));
    }

    @GetMapping("/images/{imageId}")
    public ResponseEntity<byte[]> getImage(@PathVariable String imageId) {
        StoredFile file = imageService.getImage(imageId);
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(file.getContentType()))
                .cacheControl(IMMUTABLE)
                .body(file.getData());
    }

    // ==================== ANIMAL GALLERY ====================

    @GetMapping("/groups/{id}/animals/{animalId}/images")
    public ResponseEntity<List<AnimalImage>> listImages(@CurrentUser AuthenticatedUser user,
                                                        @PathVariable Long id,
                                                        @PathVariable Long animalId) {
        return ResponseEntity.ok(imageService.listImages(user, id, animalId));
    }

    @PostMapping("/groups/{id}/animals/{animalId}/images")
    public ResponseEntity<AnimalImage> uploadToGallery(@CurrentUser AuthenticatedUser user,
                                                       @PathVariable Long id,
                                                       @PathVariable Long animalId,
                                                       @RequestParam("image") MultipartFile image,
                                                       @RequestParam(required = false) String caption) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(imageService.uploadToGallery(user, id, animalId, image, caption));
    }

    @DeleteMapping("/groups/{id}/animals/{animalId}/images/{imageId}")
    public ResponseEntity<Map<String, String>> deleteImage(@CurrentUser AuthenticatedUser user,
                                                           @PathVariable Long id,
                                                           @PathVariable Long animalId,
                                                           @PathVariable Long imageId) {
        imageService.deleteImage(user, id, animalId, imageId);
        return ResponseEntity.ok(Map.of("message", "Image deleted successfully"));
    }

    @PutMapping("/groups/{id}/animals/{animalId}/images/{imageId}/set-profile")
    public ResponseEntity<Map<String, Object>> setProfilePicture(@CurrentUser AuthenticatedUser user,
                                                                 @PathVariable Long id,
                                                                 @PathVariable Long animalId,
                                                                 @PathVariable Long imageId) {
        return ResponseEntity.ok(imageService.setProfilePicture(user, id, animalId, imageId));
    }

    @GetMapping("/groups/{id}/deleted-images")
    public ResponseEntity<List<AnimalImage>> deletedImages(@CurrentUser AuthenticatedUser user, @PathVariable Long id) {
        return ResponseEntity.ok(imageService.deletedImages(user, id));
    }

    @GetMapping("/admin/deleted-images")
    public ResponseEntity<List<AnimalImage>> allDeletedImages() {
        return ResponseEntity.ok(imageService.allDeletedImages());
    }
}

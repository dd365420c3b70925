package com.volunteermedia.service;

import com.volunteermedia.exception.ForbiddenException;
import com.volunteermedia.exception.NotFoundException;
import com.volunteermedia.model.Animal;
import com.volunteermedia.model.StoredFile;
import com.volunteermedia.repository.AnimalRepository;
import com.volunteermedia.repository.StoredFileRepository;
import com.volunteermedia.security.AuthenticatedUser;
import com.volunteermedia.upload.UploadValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Protocol documents (PDF/DOCX) attached to an animal.
 *
 * The document is readable only by members of the animal's group; it is served inline
 * from /api/documents/{uuid}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentService {

    public static final String DOCUMENT_URL_PREFIX = "/api/documents/";

    private final StoredFileRepository storedFileRepository;
    private final AnimalRepository animalRepository;
    private final GroupAccessService groupAccessService;

    @Transactional
    public Map<String, Object> uploadProtocolDocument(AuthenticatedUser user, Long groupId, Long animalId,
                                                      MultipartFile file) {
        groupAccessService.requireAccess(user, groupId);
        Animal animal = requireAnimal(groupId, animalId);

        byte[] bytes = ImageService.readBytes(file);
        String contentType = UploadValidator.validateDocument(file.getOriginalFilename(), bytes);
        String fileName = UploadValidator.sanitizeFileName(file.getOriginalFilename());

        String previous = animal.getProtocolDocumentUrl();

        StoredFile stored = new StoredFile();
        stored.setId(UUID.randomUUID().toString());
        stored.setKind(StoredFile.Kind.DOCUMENT);
        stored.setContentType(contentType);
        stored.setFileName(fileName);
        stored.setData(bytes);
        stored.setSize(bytes.length);
        storedFileRepository.save(stored);

        animal.setProtocolDocumentUrl(DOCUMENT_URL_PREFIX + stored.getId());
        animal.setProtocolDocumentName(fileName);
        animal.setProtocolDocumentType(contentType);
        animal.setProtocolDocumentSize((long) bytes.length);
        animal.setProtocolDocumentUserId(user.userId());
        animalRepository.save(animal);

        removeStoredDocument(previous);

        log.info("User {} uploaded protocol document {} ({} bytes) for animal {}",
                user.userId(), stored.getId(), bytes.length, animalId);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("url", animal.getProtocolDocumentUrl());
        body.put("name", fileName);
        body.put("size", bytes.length);
        body.put("type", contentType);
        body.put("uploaded_by", user.userId());
        return body;
    }

    @Transactional
    public void deleteProtocolDocument(AuthenticatedUser user, Long groupId, Long animalId) {
        groupAccessService.requireModerator(user, groupId);
        Animal animal = requireAnimal(groupId, animalId);

        String previous = animal.getProtocolDocumentUrl();
        if (previous == null) {
            throw new NotFoundException("Animal has no protocol document");
        }

        animal.setProtocolDocumentUrl(null);
        animal.setProtocolDocumentName(null);
        animal.setProtocolDocumentType(null);
        animal.setProtocolDocumentSize(null);
        animal.setProtocolDocumentUserId(null);
        animalRepository.save(animal);

        removeStoredDocument(previous);
        log.info("User {} removed protocol document of animal {}", user.userId(), animalId);
    }

    /**
     * Fetch a document for download. Only members of the owning animal's group may read it.
     */
    @Transactional(readOnly = true)
    public StoredFile getDocument(AuthenticatedUser user, String documentId) {
        Animal animal = animalRepository.findByProtocolDocumentUrlAndDeletedAtIsNull(DOCUMENT_URL_PREFIX + documentId)
                .orElseThrow(() -> new NotFoundException("Document not found"));

        if (!groupAccessService.canAccess(user, animal.getGroupId())) {
            throw new ForbiddenException("Access denied: You must be a member of this group to view this document");
        }

        return storedFileRepository.findByIdAndKind(documentId, StoredFile.Kind.DOCUMENT)
                .orElseThrow(() -> new NotFoundException("Document not found"));
    }

    private void removeStoredDocument(String url) {
        if (url != null && url.startsWith(DOCUMENT_URL_PREFIX)) {
            storedFileRepository.deleteById(url.substring(DOCUMENT_URL_PREFIX.length()));
        }
    }

    private Animal requireAnimal(Long groupId, Long animalId) {
        return animalRepository.findByIdAndGroupIdAndDeletedAtIsNull(animalId, groupId)
                .orElseThrow(() -> new NotFoundException("Animal not found"));
    }
}

package com.volunteermedia.controller;

import com.volunteermedia.model.StoredFile;
import com.volunteermedia.security.AuthenticatedUser;
import com.volunteermedia.security.CurrentUser;
import com.volunteermedia.service.DocumentService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Per-animal protocol documents (PDF or DOCX). Unlike images, downloads are restricted to
 * members of the animal's group.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class DocumentController {

    private final DocumentService documentService;

    @PostMapping("/groups/{id}/animals/{animalId}/protocol-document")
    public ResponseEntity<Map<String, Object>> uploadProtocolDocument(@CurrentUser AuthenticatedUser user,
                                                                      @PathVariable Long id,
                                                                      @PathVariable Long animalId,
                                                                      @RequestParam("document") MultipartFile document) {
        return ResponseEntity.ok(documentService.uploadProtocolDocument(user, id, animalId, document));
    }

    @DeleteMapping("/groups/{id}/animals/{animalId}/protocol-document")
    public ResponseEntity<Map<String, String>> deleteProtocolDocument(@CurrentUser AuthenticatedUser user,
                                                                      @PathVariable Long id,
                                                                      @PathVariable Long animalId) {
        documentService.deleteProtocolDocument(user, id, animalId);
        return ResponseEntity.ok(Map.of("message", "Protocol document deleted successfully"));
    }

    @GetMapping("/documents/{documentId}")
    public ResponseEntity<byte[]> getDocument(@CurrentUser AuthenticatedUser user, @PathVariable String documentId) {
        StoredFile file = documentService.getDocument(user, documentId);
        ContentDisposition disposition = ContentDisposition.inline()
                .filename(file.getFileName() == null ? documentId : file.getFileName(), StandardCharsets.UTF_8)
                .build();
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(file.getContentType()))
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .body(file.getData());
    }
}

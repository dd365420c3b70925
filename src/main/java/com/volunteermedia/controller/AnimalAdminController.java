package com.volunteermedia.controller;

import com.volunteermedia.dto.AnimalRequest;
import com.volunteermedia.dto.BulkAnimalUpdateRequest;
import com.volunteermedia.model.Animal;
import com.volunteermedia.security.AuthenticatedUser;
import com.volunteermedia.security.CurrentUser;
import com.volunteermedia.service.AnimalCsvService;
import com.volunteermedia.service.AnimalService;
import com.volunteermedia.service.CommentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Site-admin animal management across all groups, plus CSV import and export.
 */
@RestController
@RequestMapping("/api/admin/animals")
@RequiredArgsConstructor
public class AnimalAdminController {

    private static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);

    private final AnimalService animalService;
    private final AnimalCsvService animalCsvService;

    @GetMapping
    public ResponseEntity<List<Animal>> listAnimals(@RequestParam(required = false) String status,
                                                    @RequestParam(name = "group_id", required = false) Long groupId,
                                                    @RequestParam(required = false) String name) {
        return ResponseEntity.ok(animalService.listAllAnimals(status, groupId, name));
    }

    /**
     * POST /api/admin/animals/bulk-update
     *
     * {
     *   "animal_ids": [4, 7, 9],
     *   "status": "adopted"
     * }
     */
    @PostMapping("/bulk-update")
    public ResponseEntity<Map<String, Object>> bulkUpdate(@CurrentUser AuthenticatedUser admin,
                                                          @RequestBody BulkAnimalUpdateRequest request) {
        int count = animalService.bulkUpdate(admin, request);
        return ResponseEntity.ok(BulkAnimalController.bulkResult(count));
    }

    @PutMapping("/{animalId}")
    public ResponseEntity<Animal> updateAnimal(@CurrentUser AuthenticatedUser admin,
                                               @PathVariable Long animalId,
                                               @Valid @RequestBody AnimalRequest request) {
        return ResponseEntity.ok(animalService.adminUpdate(admin, animalId, request));
    }

    @GetMapping("/export-csv")
    public ResponseEntity<String> exportCsv(@RequestParam(name = "group_id", required = false) Long groupId) {
        return csv("animals_" + LocalDate.now() + ".csv", animalCsvService.exportAnimals(groupId));
    }

    @GetMapping("/export-comments-csv")
    public ResponseEntity<String> exportCommentsCsv(@RequestParam(name = "group_id", required = false) Long groupId,
                                                    @RequestParam(name = "animal_id", required = false) Long animalId,
                                                    @RequestParam(required = false) String tags) {
        String body = animalCsvService.exportComments(groupId, animalId, CommentService.splitCsv(tags));
        return csv("comments_" + LocalDate.now() + ".csv", body);
    }

    /**
     * POST /api/admin/animals/import-csv (multipart: file, optional group_id)
     *
     * Returns the number imported plus one warning per skipped line.
     */
    @PostMapping("/import-csv")
    public ResponseEntity<Map<String, Object>> importCsv(@RequestParam("file") MultipartFile file,
                                                         @RequestParam(name = "group_id", required = false) Long groupId) {
        AnimalCsvService.ImportResult result;
        try (InputStream content = file.getInputStream()) {
            result = animalCsvService.importAnimals(file.getOriginalFilename(), content, groupId);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Successfully imported " + result.count() + " animals");
        body.put("count", result.count());
        body.put("warnings", result.warnings());
        return ResponseEntity.ok(body);
    }

    private static ResponseEntity<String> csv(String fileName, String body) {
        return ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(fileName).build().toString())
                .body(body);
    }
}

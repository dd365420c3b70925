package com.volunteermedia.controller;

import com.volunteermedia.dto.AnimalRequest;
import com.volunteermedia.model.Animal;
import com.volunteermedia.model.AnimalNameHistory;
import com.volunteermedia.security.AuthenticatedUser;
import com.volunteermedia.security.CurrentUser;
import com.volunteermedia.service.AnimalService;
import jakarta.validation.Valid;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * ANIMALS IN A GROUP
 * ==================
 *
 * Every route needs access to the group: membership, or site admin. Deleting an animal
 * needs a group admin.
 *
 * LIST FILTERS:
 * -------------
 * status - a single status, a comma separated list, or "all".
 *          Defaults to available + bite_quarantine.
 * name   - case-insensitive substring match
 */
@RestController
@RequestMapping("/api/groups/{id}/animals")
@RequiredArgsConstructor
public class AnimalController {

    private final AnimalService animalService;

    @GetMapping
    public ResponseEntity<List<Animal>> listAnimals(@CurrentUser AuthenticatedUser user,
                                                    @PathVariable Long id,
                                                    @RequestParam(required = false) String status,
                                                    @RequestParam(required = false) String name) {
        return ResponseEntity.ok(animalService.listAnimals(user, id, status, name));
    }

    @GetMapping("/check-duplicates")
    public ResponseEntity<Map<String, Object>> checkDuplicates(@CurrentUser AuthenticatedUser user,
                                                               @PathVariable Long id,
                                                               @RequestParam(required = false) String name) {
        return ResponseEntity.ok(animalService.checkDuplicates(user, id, name));
    }

    @GetMapping("/{animalId}")
    public ResponseEntity<Animal> getAnimal(@CurrentUser AuthenticatedUser user,
                                            @PathVariable Long id,
                                            @PathVariable Long animalId) {
        return ResponseEntity.ok(animalService.getAnimal(user, id, animalId));
    }

    /**
     * POST /api/groups/{id}/animals
     *
     * {
     *   "name": "Buddy",
     *   "species": "Dog",
     *   "breed": "Labrador Mix",
     *   "estimated_birth_date": "2021-03-01",
     *   "status": "available"
     * }
     */
    @PostMapping
    public ResponseEntity<Animal> createAnimal(@CurrentUser AuthenticatedUser user,
                                               @PathVariable Long id,
                                               @Valid @RequestBody AnimalRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(animalService.createAnimal(user, id, request));
    }

    @PutMapping("/{animalId}")
    public ResponseEntity<Animal> updateAnimal(@CurrentUser AuthenticatedUser user,
                                               @PathVariable Long id,
                                               @PathVariable Long animalId,
                                               @Valid @RequestBody AnimalRequest request) {
        return ResponseEntity.ok(animalService.updateAnimal(user, id, animalId, request));
    }

    @DeleteMapping("/{animalId}")
    public ResponseEntity<Map<String, String>> deleteAnimal(@CurrentUser AuthenticatedUser user,
                                                            @PathVariable Long id,
                                                            @PathVariable Long animalId) {
        animalService.deleteAnimal(user, id, animalId);
        return ResponseEntity.ok(Map.of("message", "Animal deleted successfully"));
    }

    @PutMapping("/{animalId}/tags")
    public ResponseEntity<Animal> setTags(@CurrentUser AuthenticatedUser user,
                                          @PathVariable Long id,
                                          @PathVariable Long animalId,
                                          @RequestBody TagAssignmentRequest request) {
        return ResponseEntity.ok(animalService.setTags(user, id, animalId, request.getTagIds()));
    }

    @GetMapping("/{animalId}/name-history")
    public ResponseEntity<List<AnimalNameHistory>> nameHistory(@CurrentUser AuthenticatedUser user,
                                                               @PathVariable Long id,
                                                               @PathVariable Long animalId) {
        return ResponseEntity.ok(animalService.nameHistory(user, id, animalId));
    }

    // ==================== DTOs ====================

    @Data
    public static class TagAssignmentRequest {
        private List<Long> tagIds;
    }
}

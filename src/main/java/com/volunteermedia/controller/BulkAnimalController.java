package com.volunteermedia.controller;

import com.volunteermedia.dto.BulkAnimalUpdateRequest;
import com.volunteermedia.model.Animal;
import com.volunteermedia.security.AuthenticatedUser;
import com.volunteermedia.security.CurrentUser;
import com.volunteermedia.service.AnimalService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bulk animal editing for group admins, limited to the groups they administer.
 */
@RestController
@RequestMapping("/api/bulk-animals")
@RequiredArgsConstructor
public class BulkAnimalController {

    private final AnimalService animalService;

    @GetMapping
    public ResponseEntity<List<Animal>> listAnimals(@CurrentUser AuthenticatedUser user,
                                                    @RequestParam(required = false) String status,
                                                    @RequestParam(name = "group_id", required = false) Long groupId,
                                                    @RequestParam(required = false) String name) {
        return ResponseEntity.ok(animalService.listBulkAnimals(user, status, groupId, name));
    }

    @PostMapping("/bulk-update")
    public ResponseEntity<Map<String, Object>> bulkUpdate(@CurrentUser AuthenticatedUser user,
                                                          @RequestBody BulkAnimalUpdateRequest request) {
        return ResponseEntity.ok(bulkResult(animalService.bulkUpdate(user, request)));
    }

    static Map<String, Object> bulkResult(int count) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Successfully updated " + count + " animals");
        body.put("count", count);
        return body;
    }
}

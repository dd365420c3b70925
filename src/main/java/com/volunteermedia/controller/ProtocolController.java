package com.volunteermedia.controller;

import com.volunteermedia.dto.ProtocolRequest;
import com.volunteermedia.model.Protocol;
import com.volunteermedia.security.AuthenticatedUser;
import com.volunteermedia.security.CurrentUser;
import com.volunteermedia.service.ImageService;
import com.volunteermedia.service.ProtocolService;
import jakarta.validation.Valid;
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
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/groups/{id}/protocols")
@RequiredArgsConstructor
public class ProtocolController {

    private final ProtocolService protocolService;
    private final ImageService imageService;

    @GetMapping
    public ResponseEntity<List<Protocol>> listProtocols(@CurrentUser AuthenticatedUser user, @PathVariable Long id) {
        return ResponseEntity.ok(protocolService.listProtocols(user, id));
    }

    @GetMapping("/{protocolId}")
    public ResponseEntity<Protocol> getProtocol(@CurrentUser AuthenticatedUser user,
                                                @PathVariable Long id,
                                                @PathVariable Long protocolId) {
        return ResponseEntity.ok(protocolService.getProtocol(user, id, protocolId));
    }

    @PostMapping
    public ResponseEntity<Protocol> createProtocol(@CurrentUser AuthenticatedUser user,
                                                   @PathVariable Long id,
                                                   @Valid @RequestBody ProtocolRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(protocolService.createProtocol(user, id, request));
    }

    @PutMapping("/{protocolId}")
    public ResponseEntity<Protocol> updateProtocol(@CurrentUser AuthenticatedUser user,
                                                   @PathVariable Long id,
                                                   @PathVariable Long protocolId,
                                                   @Valid @RequestBody ProtocolRequest request) {
        return ResponseEntity.ok(protocolService.updateProtocol(user, id, protocolId, request));
    }

    @DeleteMapping("/{protocolId}")
    public ResponseEntity<Map<String, String>> deleteProtocol(@CurrentUser AuthenticatedUser user,
                                                              @PathVariable Long id,
                                                              @PathVariable Long protocolId) {
        protocolService.deleteProtocol(user, id, protocolId);
        return ResponseEntity.ok(Map.of("message", "Protocol deleted successfully"));
    }

    @PostMapping("/upload-image")
    public ResponseEntity<Map<String, String>> uploadImage(@CurrentUser AuthenticatedUser user,
                                                           @PathVariable Long id,
                                                           @RequestParam("image") MultipartFile image) {
        return ResponseEntity.ok(Map.of("url", imageService.uploadProtocolImage(user, id, image)));
    }
}

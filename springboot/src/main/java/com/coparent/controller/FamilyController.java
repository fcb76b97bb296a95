package com.coparent.controller;

import com.coparent.dto.ChildRequest;
import com.coparent.dto.ChildResponse;
import com.coparent.dto.CreateFamilyRequest;
import com.coparent.dto.FamilyMemberResponse;
import com.coparent.dto.FamilyResponse;
import com.coparent.dto.InviteRequest;
import com.coparent.dto.InviteResponse;
import com.coparent.dto.JoinFamilyRequest;
import com.coparent.dto.UpdateChildRequest;
import com.coparent.dto.UpdateFamilyRequest;
import com.coparent.entity.User;
import com.coparent.exception.ValidationException;
import com.coparent.service.CurrentUserService;
import com.coparent.service.FamilyService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/families")
@RequiredArgsConstructor
@Slf4j
public class FamilyController {

    private static final String DEFAULT_FAMILY_NAME = "My Family";

    private final CurrentUserService currentUserService;
    private final FamilyService familyService;

    @GetMapping
    public ResponseEntity<List<FamilyResponse>> listMine(Authentication authentication) {
        return ResponseEntity.ok(familyService.listMine(currentUserService.resolve(authentication)));
    }

    @PostMapping
    public ResponseEntity<FamilyResponse> create(@Valid @RequestBody(required = false) CreateFamilyRequest request,
                                                 Authentication authentication) {
        String name = request == null || request.getName() == null || request.getName().isBlank()
                ? DEFAULT_FAMILY_NAME
                : request.getName().trim();
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(familyService.create(currentUserService.resolve(authentication), name));
    }

    @PostMapping("/join")
    public ResponseEntity<FamilyResponse> join(@Valid @RequestBody JoinFamilyRequest request,
                                               Authentication authentication) {
        return ResponseEntity.ok(familyService.join(currentUserService.resolve(authentication), request.getShareCode()));
    }

    @PostMapping("/accept-invite")
    public ResponseEntity<FamilyResponse> acceptInvite(Authentication authentication) {
        return familyService.acceptInvite(currentUserService.resolve(authentication))
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/{familyId}")
    public ResponseEntity<FamilyResponse> get(@PathVariable Long familyId, Authentication authentication) {
        return ResponseEntity.ok(familyService.get(familyId, currentUserService.resolve(authentication)));
    }

    @PatchMapping("/{familyId}")
    public ResponseEntity<FamilyResponse> update(@PathVariable Long familyId,
                                                 @Valid @RequestBody UpdateFamilyRequest request,
                                                 Authentication authentication) {
        return ResponseEntity.ok(familyService.update(familyId, currentUserService.resolve(authentication), request));
    }

    @DeleteMapping("/{familyId}")
    public ResponseEntity<Void> delete(@PathVariable Long familyId, Authentication authentication) {
        familyService.delete(familyId, currentUserService.resolve(authentication));
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{familyId}/invite")
    public ResponseEntity<InviteResponse> invite(@PathVariable Long familyId,
                                                 @Valid @RequestBody InviteRequest request,
                                                 Authentication authentication) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(familyService.invite(familyId, currentUserService.resolve(authentication), request.getEmail()));
    }

    @PostMapping("/{familyId}/leave")
    public ResponseEntity<Void> leave(@PathVariable Long familyId, Authentication authentication) {
        familyService.leave(familyId, currentUserService.resolve(authentication));
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{familyId}/regenerate-code")
    public ResponseEntity<Map<String, String>> regenerateCode(@PathVariable Long familyId,
                                                              Authentication authentication) {
        String code = familyService.regenerateShareCode(familyId, currentUserService.resolve(authentication));
        return ResponseEntity.ok(Map.of("shareCode", code));
    }

    @GetMapping("/{familyId}/members")
    public ResponseEntity<List<FamilyMemberResponse>> members(@PathVariable Long familyId,
                                                              Authentication authentication) {
        return ResponseEntity.ok(familyService.members(familyId, currentUserService.resolve(authentication)));
    }

    @PostMapping(value = "/{familyId}/photo", consumes = "multipart/form-data")
    public ResponseEntity<FamilyResponse> uploadPhoto(@PathVariable Long familyId,
                                                      @RequestParam("file") MultipartFile file,
                                                      Authentication authentication) {
        User actor = currentUserService.resolve(authentication);
        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException e) {
            log.warn("Could not read uploaded photo for family {}", familyId, e);
            throw new ValidationException("empty-file", "Uploaded file could not be read");
        }
        return ResponseEntity.ok(familyService.uploadPhoto(familyId, actor, content,
                file.getOriginalFilename(), file.getContentType()));
    }

    @PostMapping("/{familyId}/children")
    public ResponseEntity<ChildResponse> addChild(@PathVariable Long familyId,
                                                  @Valid @RequestBody ChildRequest request,
                                                  Authentication authentication) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(familyService.addChild(familyId, currentUserService.resolve(authentication), request));
    }

    @PatchMapping("/{familyId}/children/{childId}")
    public ResponseEntity<ChildResponse> updateChild(@PathVariable Long familyId,
                                                     @PathVariable Long childId,
                                                     @Valid @RequestBody UpdateChildRequest request,
                                                     Authentication authentication) {
        return ResponseEntity.ok(familyService.updateChild(familyId, currentUserService.resolve(authentication),
                childId, request));
    }

    @DeleteMapping("/{familyId}/children/{childId}")
    public ResponseEntity<Void> removeChild(@PathVariable Long familyId,
                                            @PathVariable Long childId,
                                            Authentication authentication) {
        familyService.removeChild(familyId, currentUserService.resolve(authentication), childId);
        return ResponseEntity.noContent().build();
    }
}

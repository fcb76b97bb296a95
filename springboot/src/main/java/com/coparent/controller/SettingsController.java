package com.coparent.controller;

import com.coparent.dto.FamilySettingsDto;
import com.coparent.dto.UserSettingsDto;
import com.coparent.service.CurrentUserService;
import com.coparent.service.SettingsService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

/**
 * The plain GET endpoints answer 204 until something has been saved; the {@code /all}
 * variants always answer with stored or default values.
 */
@RestController
@RequestMapping("/api/settings")
@RequiredArgsConstructor
public class SettingsController {

    private final CurrentUserService currentUserService;
    private final SettingsService settingsService;

    @GetMapping("/user")
    public ResponseEntity<UserSettingsDto> userSettings(Authentication authentication) {
        return settingsService.getUserSettings(currentUserService.resolve(authentication))
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/all")
    public ResponseEntity<UserSettingsDto> allUserSettings(Authentication authentication) {
        return ResponseEntity.ok(settingsService.getAllUserSettings(currentUserService.resolve(authentication)));
    }

    @PutMapping("/user")
    public ResponseEntity<UserSettingsDto> updateUserSettings(@Valid @RequestBody UserSettingsDto request,
                                                              Authentication authentication) {
        return ResponseEntity.ok(settingsService.updateUserSettings(currentUserService.resolve(authentication),
                request));
    }

    @GetMapping("/family/{familyId}")
    public ResponseEntity<FamilySettingsDto> familySettings(@PathVariable Long familyId,
                                                            Authentication authentication) {
        return settingsService.getFamilySettings(familyId, currentUserService.resolve(authentication))
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/family/{familyId}/all")
    public ResponseEntity<FamilySettingsDto> allFamilySettings(@PathVariable Long familyId,
                                                               Authentication authentication) {
        return ResponseEntity.ok(settingsService.getAllFamilySettings(familyId,
                currentUserService.resolve(authentication)));
    }

    @PutMapping("/family/{familyId}")
    public ResponseEntity<FamilySettingsDto> updateFamilySettings(@PathVariable Long familyId,
                                                                  @Valid @RequestBody FamilySettingsDto request,
                                                                  Authentication authentication) {
        return ResponseEntity.ok(settingsService.updateFamilySettings(familyId,
                currentUserService.resolve(authentication), request));
    }
}

package com.coparent.controller;

import com.coparent.dto.PushTokenRequest;
import com.coparent.dto.UpdateProfileRequest;
import com.coparent.dto.UserResponse;
import com.coparent.service.CurrentUserService;
import com.coparent.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
public class UserController {

    private final CurrentUserService currentUserService;
    private final UserService userService;

    @GetMapping("/me")
    public ResponseEntity<UserResponse> me(Authentication authentication) {
        return ResponseEntity.ok(userService.me(currentUserService.resolve(authentication)));
    }

    @PatchMapping("/me")
    public ResponseEntity<UserResponse> updateProfile(@Valid @RequestBody UpdateProfileRequest request,
                                                      Authentication authentication) {
        return ResponseEntity.ok(userService.updateProfile(currentUserService.resolve(authentication), request));
    }

    @PostMapping("/me/push-tokens")
    public ResponseEntity<Void> registerPushToken(@Valid @RequestBody PushTokenRequest request,
                                                  Authentication authentication) {
        userService.registerPushToken(currentUserService.resolve(authentication), request);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/me/push-tokens/{token}")
    public ResponseEntity<Void> unregisterPushToken(@PathVariable String token, Authentication authentication) {
        userService.unregisterPushToken(currentUserService.resolve(authentication), token);
        return ResponseEntity.noContent().build();
    }
}

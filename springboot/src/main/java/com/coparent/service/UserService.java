package com.coparent.service;

import com.coparent.dto.PushTokenRequest;
import com.coparent.dto.UpdateProfileRequest;
import com.coparent.dto.UserResponse;
import com.coparent.entity.PushToken;
import com.coparent.entity.User;
import com.coparent.repository.PushTokenRepository;
import com.coparent.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

    private final UserRepository userRepository;
    private final PushTokenRepository pushTokenRepository;

    public UserResponse me(User actor) {
        return UserResponse.from(actor);
    }

    @Transactional
    public UserResponse updateProfile(User actor, UpdateProfileRequest request) {
        if (request.getFullName() != null) {
            actor.setFullName(request.getFullName().trim());
        }
        if (request.getPhotoUrl() != null) {
            actor.setPhotoUrl(request.getPhotoUrl());
        }
        if (request.getCalendarColor() != null) {
            actor.setCalendarColor(request.getCalendarColor());
        }
        User saved = userRepository.save(actor);
        log.info("Profile updated for user {}", saved.getId());
        return UserResponse.from(saved);
    }

    /**
     * Upserts a device token. A token last registered by another account moves to the caller.
     */
    @Transactional
    public void registerPushToken(User actor, PushTokenRequest request) {
        String token = request.getToken().trim();
        PushToken pushToken = pushTokenRepository.findByToken(token)
                .orElseGet(() -> PushToken.builder().token(token).build());
        if (pushToken.getUserId() != null && !pushToken.getUserId().equals(actor.getId())) {
            log.info("Push token moved from user {} to {}", pushToken.getUserId(), actor.getId());
        }
        pushToken.setUserId(actor.getId());
        if (request.getPlatform() != null) {
            pushToken.setPlatform(request.getPlatform());
        }
        pushTokenRepository.save(pushToken);
    }

    @Transactional
    public boolean unregisterPushToken(User actor, String token) {
        return pushTokenRepository.deleteByUserIdAndToken(actor.getId(), token) > 0;
    }
}

package com.coparent.service;

import com.coparent.entity.User;
import com.coparent.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.Authentication;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Maps the authenticated principal onto a local {@link User}, creating the row
 * on the caller's first request.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CurrentUserService {

    private final UserRepository userRepository;

    @Transactional
    public User resolve(Authentication authentication) {
        String userId = authentication.getName();
        return userRepository.findById(userId).orElseGet(() -> provision(userId, authentication));
    }

    private User provision(String userId, Authentication authentication) {
        String email = null;
        String name = null;
        if (authentication.getPrincipal() instanceof Jwt jwt) {
            email = jwt.getClaimAsString("email");
            name = jwt.getClaimAsString("name");
        }
        if (email == null || email.isBlank()) {
            email = userId;
        }
        if (name == null || name.isBlank()) {
            int at = email.indexOf('@');
            name = at > 0 ? email.substring(0, at) : email;
        }

        User user = userRepository.save(User.builder()
                .id(userId)
                .email(email.trim().toLowerCase())
                .fullName(name)
                .build());
        log.info("Provisioned user {} ({})", userId, user.getEmail());
        return user;
    }
}

package com.coparent.service;

import com.coparent.exception.InternalErrorException;
import com.coparent.repository.FamilyRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;

@Component
@RequiredArgsConstructor
public class ShareCodeGenerator {

    static final int MAX_ATTEMPTS = 5;

    private final SecureRandom random = new SecureRandom();
    private final FamilyRepository familyRepository;

    public String nextUniqueCode() {
        for (int i = 0; i < MAX_ATTEMPTS; i++) {
            String code = String.valueOf(100000 + random.nextInt(900000));
            if (!familyRepository.existsByShareCode(code)) {
                return code;
            }
        }
        throw new InternalErrorException("share-code-generation-failed", "Could not generate a unique share code");
    }
}

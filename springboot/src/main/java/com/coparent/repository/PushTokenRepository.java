package com.coparent.repository;

import com.coparent.entity.PushToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface PushTokenRepository extends JpaRepository<PushToken, Long> {
    List<PushToken> findByUserIdIn(Collection<String> userIds);
    Optional<PushToken> findByToken(String token);

    // own transaction: may run from an after-commit callback
    @Modifying
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    @Query("DELETE FROM PushToken t WHERE t.token IN :tokens")
    int deleteByTokenIn(Collection<String> tokens);

    @Modifying
    @Transactional
    @Query("DELETE FROM PushToken t WHERE t.userId = :userId AND t.token = :token")
    int deleteByUserIdAndToken(String userId, String token);
}

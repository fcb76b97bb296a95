package com.coparent.repository;

import com.coparent.entity.Notification;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface NotificationRepository extends JpaRepository<Notification, Long> {

    @Query("SELECT n FROM Notification n WHERE n.userId = :userId " +
            "AND (:familyId IS NULL OR n.familyId = :familyId) " +
            "AND (:unreadOnly = false OR n.read = false) ORDER BY n.createdAt DESC")
    List<Notification> search(String userId, Long familyId, boolean unreadOnly, Pageable page);

    @Query("SELECT COUNT(n) FROM Notification n WHERE n.userId = :userId " +
            "AND (:familyId IS NULL OR n.familyId = :familyId) " +
            "AND (:unreadOnly = false OR n.read = false)")
    long count(String userId, Long familyId, boolean unreadOnly);

    Optional<Notification> findByIdAndUserId(Long id, String userId);

    @Modifying
    @Query("UPDATE Notification n SET n.read = true WHERE n.userId = :userId AND n.id IN :ids")
    int markRead(String userId, Collection<Long> ids);

    @Modifying
    @Query("UPDATE Notification n SET n.read = true WHERE n.userId = :userId AND n.read = false " +
            "AND (:familyId IS NULL OR n.familyId = :familyId)")
    int markAllRead(String userId, Long familyId);

    @Query("SELECT n FROM Notification n WHERE n.userId = :userId AND (:familyId IS NULL OR n.familyId = :familyId)")
    List<Notification> findAllForUser(String userId, Long familyId);

    long deleteByFamilyId(Long familyId);
}

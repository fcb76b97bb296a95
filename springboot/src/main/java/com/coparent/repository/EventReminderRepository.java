package com.coparent.repository;

import com.coparent.entity.EventReminder;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface EventReminderRepository extends JpaRepository<EventReminder, Long> {
    Optional<EventReminder> findByEventId(Long eventId);

    List<EventReminder> findBySentFalseAndSendAtLessThanEqualOrderBySendAtAsc(Instant now, Pageable page);

    long deleteByEventId(Long eventId);

    long deleteBySentTrueAndSentAtBefore(Instant cutoff);

    long deleteByFamilyId(Long familyId);
}

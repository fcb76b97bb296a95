package com.coparent.repository;

import com.coparent.entity.TaskReminder;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface TaskReminderRepository extends JpaRepository<TaskReminder, Long> {
    Optional<TaskReminder> findByTaskId(Long taskId);

    List<TaskReminder> findBySentFalseAndSendAtLessThanEqualOrderBySendAtAsc(Instant now, Pageable page);

    long deleteByTaskId(Long taskId);

    long deleteBySentTrueAndSentAtBefore(Instant cutoff);

    long deleteByFamilyId(Long familyId);
}

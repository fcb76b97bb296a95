package com.coparent.repository;

import com.coparent.entity.ParentSlot;
import com.coparent.entity.Task;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface TaskRepository extends JpaRepository<Task, Long> {
    Optional<Task> findByIdAndFamilyId(Long id, Long familyId);

    @Query("SELECT t FROM Task t WHERE t.familyId = :familyId " +
            "AND (:status IS NULL OR t.status = :status) " +
            "AND (:assignedTo IS NULL OR t.assignedTo = :assignedTo) " +
            "AND (:category IS NULL OR t.category = :category)")
    List<Task> search(Long familyId, Task.Status status, ParentSlot assignedTo, Task.Category category);

    long countByFamilyId(Long familyId);
    long countByFamilyIdAndStatus(Long familyId, Task.Status status);
    long countByFamilyIdAndStatusInAndDueDateBefore(Long familyId, Collection<Task.Status> statuses, Instant before);

    long deleteByFamilyId(Long familyId);
}

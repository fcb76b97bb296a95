package com.coparent.repository;

import com.coparent.entity.CalendarEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface CalendarEventRepository extends JpaRepository<CalendarEvent, Long> {
    List<CalendarEvent> findByFamilyIdOrderByStartDateAsc(Long familyId);
    List<CalendarEvent> findByFamilyIdAndTypeOrderByStartDateAsc(Long familyId, CalendarEvent.EventType type);
    Optional<CalendarEvent> findByIdAndFamilyId(Long id, Long familyId);

    /**
     * Events overlapping the closed interval [from, to].
     */
    @Query("SELECT e FROM CalendarEvent e WHERE e.familyId = :familyId " +
            "AND e.startDate <= :to AND e.endDate >= :from " +
            "AND (:type IS NULL OR e.type = :type) ORDER BY e.startDate ASC")
    List<CalendarEvent> findOverlapping(Long familyId, Instant from, Instant to, CalendarEvent.EventType type);

    long deleteByFamilyIdAndSwapRequestId(Long familyId, Long swapRequestId);

    long deleteByFamilyId(Long familyId);
}

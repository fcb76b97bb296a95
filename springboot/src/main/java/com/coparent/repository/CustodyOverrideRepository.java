package com.coparent.repository;

import com.coparent.entity.CustodyOverride;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface CustodyOverrideRepository extends JpaRepository<CustodyOverride, Long> {
    List<CustodyOverride> findByFamilyIdOrderByStartDateAsc(Long familyId);
    Optional<CustodyOverride> findByIdAndFamilyId(Long id, Long familyId);

    @Query("SELECT o FROM CustodyOverride o WHERE o.familyId = :familyId AND o.status = :status " +
            "AND o.startDate <= :to AND o.endDate >= :from ORDER BY o.startDate ASC")
    List<CustodyOverride> findOverlapping(@Param("familyId") Long familyId,
                                          @Param("status") CustodyOverride.Status status,
                                          @Param("from") Instant from,
                                          @Param("to") Instant to);

    @Query("SELECT COUNT(o) > 0 FROM CustodyOverride o WHERE o.familyId = :familyId AND o.status IN :statuses " +
            "AND o.startDate <= :to AND o.endDate >= :from")
    boolean existsOverlapping(@Param("familyId") Long familyId,
                              @Param("statuses") Collection<CustodyOverride.Status> statuses,
                              @Param("from") Instant from,
                              @Param("to") Instant to);

    long deleteByFamilyId(Long familyId);
}

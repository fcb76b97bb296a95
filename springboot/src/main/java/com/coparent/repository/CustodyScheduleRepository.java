package com.coparent.repository;

import com.coparent.entity.CustodySchedule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CustodyScheduleRepository extends JpaRepository<CustodySchedule, Long> {
    Optional<CustodySchedule> findByFamilyId(Long familyId);

    long deleteByFamilyId(Long familyId);
}

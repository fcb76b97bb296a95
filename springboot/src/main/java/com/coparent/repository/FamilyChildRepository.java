package com.coparent.repository;

import com.coparent.entity.FamilyChild;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface FamilyChildRepository extends JpaRepository<FamilyChild, Long> {
    Optional<FamilyChild> findByIdAndFamilyId(Long id, Long familyId);
    boolean existsByIdAndFamilyId(Long id, Long familyId);
}

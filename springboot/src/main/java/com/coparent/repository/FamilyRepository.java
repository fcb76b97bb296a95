package com.coparent.repository;

import com.coparent.entity.Family;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface FamilyRepository extends JpaRepository<Family, Long> {
    Optional<Family> findByShareCode(String shareCode);
    boolean existsByShareCode(String shareCode);
}

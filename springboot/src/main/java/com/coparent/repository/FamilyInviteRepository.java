package com.coparent.repository;

import com.coparent.entity.FamilyInvite;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface FamilyInviteRepository extends JpaRepository<FamilyInvite, Long> {
    boolean existsByFamilyIdAndEmail(Long familyId, String email);
    Optional<FamilyInvite> findFirstByEmailAndStatusOrderByCreatedAtAsc(String email, FamilyInvite.Status status);
    List<FamilyInvite> findByFamilyIdAndStatus(Long familyId, FamilyInvite.Status status);
}

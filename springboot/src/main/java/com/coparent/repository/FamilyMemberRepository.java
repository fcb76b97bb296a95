package com.coparent.repository;

import com.coparent.entity.FamilyMember;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface FamilyMemberRepository extends JpaRepository<FamilyMember, Long> {
    List<FamilyMember> findByFamilyId(Long familyId);
    List<FamilyMember> findByUserId(String userId);
    boolean existsByFamilyIdAndUserId(Long familyId, String userId);
    long countByFamilyId(Long familyId);

    @Query("SELECT m.user.id FROM FamilyMember m WHERE m.family.id = :familyId ORDER BY m.user.id ASC")
    List<String> findUserIdsByFamilyId(Long familyId);
}

package com.coparent.repository;

import com.coparent.entity.SwapRequest;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SwapRequestRepository extends JpaRepository<SwapRequest, Long> {
    List<SwapRequest> findByFamilyIdOrderByCreatedAtDesc(Long familyId);
    List<SwapRequest> findByFamilyIdAndStatusOrderByCreatedAtDesc(Long familyId, SwapRequest.Status status);
    Optional<SwapRequest> findByIdAndFamilyId(Long id, Long familyId);

    long deleteByFamilyId(Long familyId);
}

package com.coparent.repository;

import com.coparent.entity.FamilySettings;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface FamilySettingsRepository extends JpaRepository<FamilySettings, Long> {
}

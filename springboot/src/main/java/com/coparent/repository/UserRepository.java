package com.coparent.repository;

import com.coparent.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

@Repository
public interface UserRepository extends JpaRepository<User, String> {

    @Modifying
    @Query("UPDATE User u SET u.activeFamilyId = null WHERE u.activeFamilyId = :familyId")
    int clearActiveFamily(Long familyId);
}

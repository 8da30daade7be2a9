package com.openforge.rxmate.repository;

import com.openforge.rxmate.domain.PharmacyUser;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

@Repository
public interface PharmacyUserRepository extends JpaRepository<PharmacyUser, String>,
        JpaSpecificationExecutor<PharmacyUser> {
}

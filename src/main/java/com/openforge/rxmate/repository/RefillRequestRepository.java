package com.openforge.rxmate.repository;

import com.openforge.rxmate.domain.RefillRequest;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RefillRequestRepository extends JpaRepository<RefillRequest, String> {

    List<RefillRequest> findByPrescriptionId(String prescriptionId);
}

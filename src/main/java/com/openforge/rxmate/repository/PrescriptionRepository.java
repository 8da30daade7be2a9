package com.openforge.rxmate.repository;

import com.openforge.rxmate.domain.Prescription;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PrescriptionRepository extends JpaRepository<Prescription, String>,
        JpaSpecificationExecutor<Prescription> {

    @Query("""
            select p from Prescription p
            join fetch p.medication
            where p.userId = :userId
            order by p.prescriptionId
            """)
    List<Prescription> findByUserIdWithMedication(@Param("userId") String userId);
}

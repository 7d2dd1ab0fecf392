package com.carehub.billing.repository;

import com.carehub.billing.entity.PatientTreatment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public interface PatientTreatmentRepository extends JpaRepository<PatientTreatment, Long> {

    boolean existsByIdAndPatientId(Long id, Long patientId);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PatientTreatment t SET t.status = true WHERE t.id = :id")
    int markActive(@Param("id") Long id);
}

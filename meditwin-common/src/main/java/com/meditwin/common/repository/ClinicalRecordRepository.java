package com.meditwin.common.repository;

import com.meditwin.common.entity.ClinicalRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ClinicalRecordRepository extends JpaRepository<ClinicalRecordEntity, UUID> {

    Optional<ClinicalRecordEntity> findByPatientKeyAndDocumentId(String patientKey, String documentId);

    List<ClinicalRecordEntity> findByPatientKeyOrderByStoredAtDesc(String patientKey);

    @Transactional
    long deleteByPatientKey(String patientKey);
}

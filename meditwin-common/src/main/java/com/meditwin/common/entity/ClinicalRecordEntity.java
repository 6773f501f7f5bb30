package com.meditwin.common.entity;

import jakarta.persistence.*;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Canonical copy of an extracted clinical record (the document store). Keyed by the store-specific
 * patient hash and the document id.
 */
@Entity
@Table(name = "clinical_records",
        uniqueConstraints = @UniqueConstraint(name = "uk_record_patient_document",
                columnNames = { "patient_key", "document_id" }),
        indexes = @Index(name = "idx_record_patient_key", columnList = "patient_key"))
public class ClinicalRecordEntity {

    public static final String STORAGE_VERSION = "1.0";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "patient_key", nullable = false, length = 64)
    private String patientKey;

    @Column(name = "document_id", nullable = false, length = 64)
    private String documentId;

    @Column(name = "document_title", length = 255)
    private String documentTitle;

    @Column(name = "document_date", length = 64)
    private String documentDate;

    @Column(name = "record_json", nullable = false, columnDefinition = "TEXT")
    private String recordJson;

    @Column(name = "storage_version", nullable = false, length = 10)
    private String storageVersion = STORAGE_VERSION;

    @Column(name = "stored_at", nullable = false)
    private LocalDateTime storedAt;

    public ClinicalRecordEntity() {
        this.storedAt = LocalDateTime.now();
    }

    public ClinicalRecordEntity(String patientKey, String documentId, String documentTitle,
            String documentDate, String recordJson) {
        this();
        this.patientKey = patientKey;
        this.documentId = documentId;
        this.documentTitle = documentTitle;
        this.documentDate = documentDate;
        this.recordJson = recordJson;
    }

    /** Replace the stored content when the same document is ingested again */
    public void replaceContent(String documentTitle, String documentDate, String recordJson) {
        this.documentTitle = documentTitle;
        this.documentDate = documentDate;
        this.recordJson = recordJson;
        this.storageVersion = STORAGE_VERSION;
        this.storedAt = LocalDateTime.now();
    }

    public UUID getId() {
        return id;
    }

    public String getPatientKey() {
        return patientKey;
    }

    public String getDocumentId() {
        return documentId;
    }

    public String getDocumentTitle() {
        return documentTitle;
    }

    public String getDocumentDate() {
        return documentDate;
    }

    public String getRecordJson() {
        return recordJson;
    }

    public String getStorageVersion() {
        return storageVersion;
    }

    public LocalDateTime getStoredAt() {
        return storedAt;
    }
}

package com.meditwin.common.entity;

import jakarta.persistence.*;
import java.time.LocalDateTime;

/**
 * Longitudinal profile of one patient: lifestyle attributes and medical history, merged across documents.
 * The attribute map is stored as a JSON document. Concurrent merges are detected through the version column.
 */
@Entity
@Table(name = "patient_profiles")
public class PatientProfile {

    @Id
    @Column(name = "patient_key", length = 64)
    private String patientKey;

    @Column(name = "attributes_json", nullable = false, columnDefinition = "TEXT")
    private String attributesJson = "{}";

    @Column(name = "document_count", nullable = false)
    private int documentCount;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Version
    @Column(name = "version")
    private Long version;

    public PatientProfile() {
        this.createdAt = LocalDateTime.now();
        this.updatedAt = LocalDateTime.now();
    }

    public PatientProfile(String patientKey) {
        this();
        this.patientKey = patientKey;
    }

    public void applyMerge(String mergedAttributesJson) {
        this.attributesJson = mergedAttributesJson;
        this.documentCount++;
        this.updatedAt = LocalDateTime.now();
    }

    public String getPatientKey() {
        return patientKey;
    }

    public String getAttributesJson() {
        return attributesJson;
    }

    public int getDocumentCount() {
        return documentCount;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }

    public Long getVersion() {
        return version;
    }
}

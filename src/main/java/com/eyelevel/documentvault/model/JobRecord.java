package com.eyelevel.documentvault.model;

import com.eyelevel.documentvault.job.JobStatus;
import com.eyelevel.documentvault.job.JobType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Data;

import java.time.Instant;

/**
 * Persisted state of a background job, so queued and in-flight work survives a worker restart.
 */
@Entity
@Table(name = "job_record", indexes = @Index(name = "idx_job_record_status", columnList = "status"))
@Data
public class JobRecord {

    @Id
    @Column(length = 36)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status;

    private Long documentId;

    private String userId;

    @Column(length = 1024)
    private String storageKey;

    private String mimeType;

    private int priority;

    private long sequence;

    private int attempts;

    private int maxAttempts;

    @Column(columnDefinition = "TEXT")
    private String lastError;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;
}

package com.eyelevel.documentvault.model;

import com.eyelevel.documentvault.storage.StorageType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "document_record", indexes = @Index(name = "idx_document_record_user", columnList = "userId"))
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DocumentRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String userId;

    private String householdId;

    @Column(nullable = false)
    private String fileName;

    @Column(nullable = false)
    private String mimeType;

    private Long fileSize;

    private String contentHash;

    @Column(nullable = false, unique = true, length = 1024)
    private String storageKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private StorageType storageType;

    private boolean encrypted;

    @ToString.Exclude
    @Column(columnDefinition = "TEXT")
    private String encryptedDocumentKey;

    /**
     * JSON of {@link EncryptionMetadata}.
     */
    @Column(columnDefinition = "TEXT")
    private String encryptionMetadata;

    /**
     * JSON of {@link com.eyelevel.documentvault.crypto.CipherMetadata} for the stored object.
     */
    @Column(columnDefinition = "TEXT")
    private String cipherMetadata;

    @Enumerated(EnumType.STRING)
    private ConversionStatus conversionStatus;

    @ToString.Exclude
    @Column(columnDefinition = "TEXT")
    private String extractedText;

    /**
     * JSON array of {@link DocumentInsight}.
     */
    @ToString.Exclude
    @Column(columnDefinition = "TEXT")
    private String insights;

    @Column(length = 1024)
    private String thumbnailKey;

    @Column(columnDefinition = "TEXT")
    private String thumbnailCipherMetadata;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}

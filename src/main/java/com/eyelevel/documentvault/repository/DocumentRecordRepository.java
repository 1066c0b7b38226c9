package com.eyelevel.documentvault.repository;

import com.eyelevel.documentvault.crypto.EncryptedKeyRecord;
import com.eyelevel.documentvault.model.DocumentRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data JPA repository for the {@link DocumentRecord} entity.
 * JPQL queries are defined in META-INF/document-record-orm.xml.
 */
@Repository
public interface DocumentRecordRepository extends JpaRepository<DocumentRecord, Long> {

    @Query(name = "DocumentRecord.findEncryptedKeys")
    List<EncryptedKeyRecord> findEncryptedKeys();

    @Modifying
    @Query(name = "DocumentRecord.updateEncryptedKey")
    int updateEncryptedKey(@Param("id") Long id, @Param("encryptedDocumentKey") String encryptedDocumentKey);

    long countByEncrypted(boolean encrypted);
}

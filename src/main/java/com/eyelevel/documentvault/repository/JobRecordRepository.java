package com.eyelevel.documentvault.repository;

import com.eyelevel.documentvault.job.JobStatus;
import com.eyelevel.documentvault.model.JobRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Spring Data JPA repository for the {@link JobRecord} entity.
 */
@Repository
public interface JobRecordRepository extends JpaRepository<JobRecord, String> {

    List<JobRecord> findByStatusInOrderBySequenceAsc(Collection<JobStatus> statuses);

    /**
     * Removes finished jobs last touched before {@code threshold}.
     *
     * @return the number of rows deleted.
     */
    @Modifying
    @Query("DELETE FROM JobRecord j WHERE j.status IN :statuses AND j.updatedAt < :threshold")
    int deleteFinishedBefore(@Param("statuses") Collection<JobStatus> statuses,
                             @Param("threshold") Instant threshold);
}

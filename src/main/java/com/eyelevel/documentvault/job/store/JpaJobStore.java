package com.eyelevel.documentvault.job.store;

import com.eyelevel.documentvault.job.Job;
import com.eyelevel.documentvault.job.JobPayload;
import com.eyelevel.documentvault.job.JobStatus;
import com.eyelevel.documentvault.job.JobStore;
import com.eyelevel.documentvault.model.JobRecord;
import com.eyelevel.documentvault.repository.JobRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * {@link JobStore} backed by the {@code job_record} table.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaJobStore implements JobStore {

    static final Set<JobStatus> UNFINISHED = EnumSet.of(JobStatus.WAITING, JobStatus.ACTIVE, JobStatus.FAILED_RETRY);

    private final JobRecordRepository jobRecordRepository;

    @Override
    public void save(Job job) {
        jobRecordRepository.save(toRecord(job));
    }

    @Override
    public List<Job> findUnfinished() {
        List<JobRecord> records = jobRecordRepository.findByStatusInOrderBySequenceAsc(UNFINISHED);
        log.debug("Found {} unfinished job record(s).", records.size());
        return records.stream().map(JpaJobStore::toJob).toList();
    }

    static JobRecord toRecord(Job job) {
        JobRecord record = new JobRecord();
        record.setId(job.getId());
        record.setType(job.getType());
        record.setStatus(job.getStatus());
        record.setDocumentId(job.getPayload().documentId());
        record.setUserId(job.getPayload().userId());
        record.setStorageKey(job.getPayload().storageKey());
        record.setMimeType(job.getPayload().mimeType());
        record.setPriority(job.getPriority());
        record.setSequence(job.getSequence());
        record.setAttempts(job.getAttempts());
        record.setMaxAttempts(job.getMaxAttempts());
        record.setLastError(job.getLastError());
        record.setCreatedAt(job.getCreatedAt());
        record.setUpdatedAt(job.getUpdatedAt());
        return record;
    }

    static Job toJob(JobRecord record) {
        JobPayload payload = new JobPayload(record.getDocumentId(), record.getUserId(), record.getStorageKey(),
                                            record.getMimeType());
        return Job.restore(record.getId(), record.getType(), payload, record.getPriority(), record.getSequence(),
                           record.getMaxAttempts(), record.getCreatedAt(), record.getStatus(), record.getAttempts(),
                           record.getLastError(), record.getUpdatedAt());
    }
}

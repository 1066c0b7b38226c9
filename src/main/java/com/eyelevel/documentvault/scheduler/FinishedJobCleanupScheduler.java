package com.eyelevel.documentvault.scheduler;

import com.eyelevel.documentvault.job.JobStatus;
import com.eyelevel.documentvault.repository.JobRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;

/**
 * Deletes completed and dead job records once they are older than the retention window. Unfinished
 * records are never touched, since they are what a restarted worker picks up.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FinishedJobCleanupScheduler {

    private final JobRecordRepository jobRecordRepository;
    private final Clock clock;

    @Value("${app.jobs.record-retention-hours:72}")
    private long retentionHours;

    @Scheduled(cron = "${app.scheduler.finished-job-cleanup}")
    @Transactional
    public void deleteFinishedJobs() {
        Instant threshold = clock.instant().minus(Duration.ofHours(retentionHours));
        int deleted = jobRecordRepository.deleteFinishedBefore(EnumSet.of(JobStatus.COMPLETED, JobStatus.DEAD),
                                                               threshold);
        if (deleted > 0) {
            log.info("Deleted {} finished job record(s) last updated before {}.", deleted, threshold);
        } else {
            log.debug("No finished job records older than {}.", threshold);
        }
    }
}

package com.eyelevel.documentvault.job;

import com.eyelevel.documentvault.job.deadletter.DeadLetterPublisher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("SynchronousJobSubmitter")
class SynchronousJobSubmitterTest {

    private static final JobPayload PAYLOAD = new JobPayload(7L, "user-1", "user-1/t/a.pdf", "application/pdf");

    @Mock
    private DeadLetterPublisher deadLetterPublisher;

    private static JobHandler handler(JobType type, HandlerBody body) {
        return new JobHandler() {
            @Override
            public JobType getJobType() {
                return type;
            }

            @Override
            public void handle(Job job, JobSubmitter submitter) throws Exception {
                body.run(job, submitter);
            }
        };
    }

    @FunctionalInterface
    private interface HandlerBody {
        void run(Job job, JobSubmitter submitter) throws Exception;
    }

    @Test
    @DisplayName("Should run the job before addJob returns")
    void runsInline() {
        List<String> executed = new ArrayList<>();
        SynchronousJobSubmitter submitter = new SynchronousJobSubmitter(
                new JobHandlerRegistry(List.of(handler(JobType.THUMBNAIL, (job, s) -> executed.add(job.getId())))),
                3, deadLetterPublisher);

        String jobId = submitter.addJob(JobType.THUMBNAIL, PAYLOAD);

        assertThat(executed).containsExactly(jobId);
        assertThat(submitter.getJob(jobId)).isEmpty();
        verifyNoInteractions(deadLetterPublisher);
    }

    @Test
    void retriesBackToBackUntilSuccess() {
        AtomicInteger calls = new AtomicInteger();
        SynchronousJobSubmitter submitter = new SynchronousJobSubmitter(
                new JobHandlerRegistry(List.of(handler(JobType.THUMBNAIL, (job, s) -> {
                    if (calls.incrementAndGet() < 3) {
                        throw new IllegalStateException("flaky");
                    }
                }))), 3, deadLetterPublisher);

        submitter.addJob(JobType.THUMBNAIL, PAYLOAD);

        assertThat(calls.get()).isEqualTo(3);
        verifyNoInteractions(deadLetterPublisher);
    }

    @Test
    @DisplayName("Should swallow handler failures and dead-letter the job")
    void deadLettersWithoutThrowing() {
        SynchronousJobSubmitter submitter = new SynchronousJobSubmitter(
                new JobHandlerRegistry(List.of(handler(JobType.THUMBNAIL, (job, s) -> {
                    throw new IllegalStateException("broken");
                }))), 2, deadLetterPublisher);

        submitter.addJob(JobType.THUMBNAIL, PAYLOAD);

        ArgumentCaptor<Job> captor = ArgumentCaptor.forClass(Job.class);
        verify(deadLetterPublisher).publish(captor.capture());
        assertThat(captor.getValue().getStatus()).isEqualTo(JobStatus.DEAD);
        assertThat(captor.getValue().getAttempts()).isEqualTo(2);
        assertThat(captor.getValue().getLastError()).contains("broken");
    }

    @Test
    void followUpJobsRunInline() {
        List<JobType> executed = new ArrayList<>();
        SynchronousJobSubmitter submitter = new SynchronousJobSubmitter(new JobHandlerRegistry(List.of(
                handler(JobType.TEXT_EXTRACTION, (job, s) -> {
                    executed.add(job.getType());
                    s.addJob(JobType.INSIGHT_GENERATION, job.getPayload());
                }),
                handler(JobType.INSIGHT_GENERATION, (job, s) -> executed.add(job.getType())))), 1,
                                                                        deadLetterPublisher);

        submitter.addJob(JobType.TEXT_EXTRACTION, PAYLOAD);

        assertThat(executed).containsExactly(JobType.TEXT_EXTRACTION, JobType.INSIGHT_GENERATION);
    }

    @Test
    void missingHandlerIsDeadLettered() {
        SynchronousJobSubmitter submitter = new SynchronousJobSubmitter(new JobHandlerRegistry(List.of()), 3,
                                                                        deadLetterPublisher);

        submitter.addJob(JobType.THUMBNAIL, PAYLOAD);

        ArgumentCaptor<Job> captor = ArgumentCaptor.forClass(Job.class);
        verify(deadLetterPublisher).publish(captor.capture());
        assertThat(captor.getValue().getLastError()).contains("No handler");
    }
}

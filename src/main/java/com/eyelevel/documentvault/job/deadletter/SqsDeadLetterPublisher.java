package com.eyelevel.documentvault.job.deadletter;

import com.eyelevel.documentvault.job.Job;
import io.awspring.cloud.sqs.operations.SqsTemplate;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;

/**
 * Sends dead jobs to an SQS queue so operators can inspect and replay them.
 */
@Slf4j
public class SqsDeadLetterPublisher implements DeadLetterPublisher {

    private final SqsTemplate sqsTemplate;
    private final String queueName;

    public SqsDeadLetterPublisher(SqsTemplate sqsTemplate, String queueName) {
        this.sqsTemplate = sqsTemplate;
        this.queueName = queueName;
        log.info("Dead jobs will be published to SQS queue '{}'.", queueName);
    }

    @Override
    public void publish(Job job) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("jobId", job.getId());
        payload.put("jobType", job.getType().name());
        payload.put("documentId", job.getPayload().documentId());
        payload.put("storageKey", job.getPayload().storageKey());
        payload.put("mimeType", job.getPayload().mimeType());
        payload.put("attempts", job.getAttempts());
        payload.put("lastError", job.getLastError());

        try {
            sqsTemplate.send(to -> to.queue(queueName)
                                     .payload(payload)
                                     .header("jobType", job.getType().name()));
            log.info("Published dead job {} ({}) to SQS queue '{}'.", job.getId(), job.getType(), queueName);
        } catch (Exception e) {
            log.error("CRITICAL: Failed to publish dead job {} to SQS queue '{}'. Payload: {}", job.getId(),
                      queueName, payload, e);
        }
    }
}

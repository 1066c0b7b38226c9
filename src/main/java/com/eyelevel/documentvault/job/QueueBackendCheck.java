package com.eyelevel.documentvault.job;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.model.GetQueueUrlRequest;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One-shot reachability check of the queue backend, used at startup to choose between the worker
 * queue and the synchronous fallback.
 */
@Slf4j
public class QueueBackendCheck {

    private final SqsAsyncClient sqsAsyncClient;
    private final String queueName;
    private final Duration timeout;

    public QueueBackendCheck(SqsAsyncClient sqsAsyncClient, String queueName, Duration timeout) {
        this.sqsAsyncClient = sqsAsyncClient;
        this.queueName = queueName;
        this.timeout = timeout;
    }

    /**
     * @return {@code true} if the queue URL could be resolved within the timeout.
     */
    public boolean isAvailable() {
        log.info("Checking queue backend '{}' with a timeout of {}.", queueName, timeout);
        try {
            String queueUrl = sqsAsyncClient.getQueueUrl(GetQueueUrlRequest.builder().queueName(queueName).build())
                                            .get(timeout.toMillis(), TimeUnit.MILLISECONDS)
                                            .queueUrl();
            log.info("Queue backend reachable at {}.", queueUrl);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while checking queue backend '{}'.", queueName);
            return false;
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            log.warn("Queue backend '{}' is unreachable: {}", queueName, e.getMessage());
            return false;
        }
    }
}

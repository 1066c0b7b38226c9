package com.eyelevel.documentvault.enrichment.handler;

import com.eyelevel.documentvault.common.json.JsonSerializer;
import com.eyelevel.documentvault.enrichment.insight.InsightEngine;
import com.eyelevel.documentvault.exception.apiclient.ApiException;
import com.eyelevel.documentvault.job.Job;
import com.eyelevel.documentvault.job.JobHandler;
import com.eyelevel.documentvault.job.JobSubmitter;
import com.eyelevel.documentvault.job.JobType;
import com.eyelevel.documentvault.model.DocumentInsight;
import com.eyelevel.documentvault.model.DocumentRecord;
import com.eyelevel.documentvault.service.metadata.MetadataStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Optional;

/**
 * Generates insights from a document's extracted text and replaces any earlier insights on the record.
 *
 * <p>Transient service errors are rethrown so the job is retried; a request the service rejects
 * outright completes the job without insights.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InsightGenerationJobHandler implements JobHandler {

    private final MetadataStore metadataStore;
    private final InsightEngine insightEngine;
    private final JsonSerializer jsonSerializer;

    @Override
    public JobType getJobType() {
        return JobType.INSIGHT_GENERATION;
    }

    @Override
    public void handle(Job job, JobSubmitter submitter) {
        Long documentId = job.getPayload().documentId();
        String contextInfo = String.format("JobId: %s, DocumentId: %d", job.getId(), documentId);

        if (!insightEngine.isAvailable()) {
            log.debug("[{}] Insight generation is disabled.", contextInfo);
            return;
        }
        Optional<DocumentRecord> found = metadataStore.getDocument(documentId);
        if (found.isEmpty() || !StringUtils.hasText(found.get().getExtractedText())) {
            log.info("[{}] No extracted text available; skipping insights.", contextInfo);
            return;
        }
        DocumentRecord record = found.get();

        List<DocumentInsight> insights;
        try {
            insights = insightEngine.generateInsights(record.getFileName(), record.getExtractedText(),
                                                      record.getMimeType());
        } catch (ApiException e) {
            if (e.isTransient()) {
                throw e;
            }
            log.warn("[{}] Insight service rejected the request with status {}: {}", contextInfo, e.getStatusCode(),
                     e.getMessage());
            return;
        }

        String insightsJson = jsonSerializer.serialize(insights);
        metadataStore.updateDocument(documentId, current -> current.setInsights(insightsJson));
        log.info("[{}] Stored {} insight(s).", contextInfo, insights.size());
    }
}

package com.eyelevel.documentvault.enrichment.handler;

import com.eyelevel.documentvault.enrichment.DocumentContentReader;
import com.eyelevel.documentvault.enrichment.text.TextExtractionEngine;
import com.eyelevel.documentvault.exception.JobRejectedException;
import com.eyelevel.documentvault.exception.OrphanRecordException;
import com.eyelevel.documentvault.job.Job;
import com.eyelevel.documentvault.job.JobHandler;
import com.eyelevel.documentvault.job.JobPayload;
import com.eyelevel.documentvault.job.JobSubmitter;
import com.eyelevel.documentvault.job.JobType;
import com.eyelevel.documentvault.model.DocumentRecord;
import com.eyelevel.documentvault.service.DocumentDeletionService;
import com.eyelevel.documentvault.service.metadata.MetadataStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Optional;

/**
 * Extracts text from a stored document, saves it on the record and queues insight generation.
 *
 * <p>Re-running overwrites the previously extracted text.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TextExtractionJobHandler implements JobHandler {

    private final MetadataStore metadataStore;
    private final DocumentContentReader contentReader;
    private final TextExtractionEngine textExtractionEngine;
    private final DocumentDeletionService deletionService;

    @Override
    public JobType getJobType() {
        return JobType.TEXT_EXTRACTION;
    }

    @Override
    public void handle(Job job, JobSubmitter submitter) throws Exception {
        JobPayload payload = job.getPayload();
        String contextInfo = String.format("JobId: %s, DocumentId: %d", job.getId(), payload.documentId());

        Optional<DocumentRecord> found = metadataStore.getDocument(payload.documentId());
        if (found.isEmpty()) {
            log.info("[{}] Document no longer exists; nothing to extract.", contextInfo);
            return;
        }
        DocumentRecord record = found.get();
        if (!textExtractionEngine.supports(record.getMimeType())) {
            log.info("[{}] No text extraction for mime type '{}'.", contextInfo, record.getMimeType());
            return;
        }

        byte[] content;
        try {
            content = contentReader.readPlaintext(record);
        } catch (OrphanRecordException e) {
            log.warn("[{}] {}. Removing the orphaned record.", contextInfo, e.getMessage());
            deletionService.purgeOrphan(record);
            return;
        }

        String text = textExtractionEngine.extractText(content, record.getMimeType());
        metadataStore.updateDocument(record.getId(), current -> current.setExtractedText(text));
        log.info("[{}] Stored {} characters of extracted text.", contextInfo, text.length());

        if (StringUtils.hasText(text)) {
            try {
                submitter.addJob(JobType.INSIGHT_GENERATION, payload);
            } catch (JobRejectedException e) {
                log.warn("[{}] Could not queue insight generation: {}", contextInfo, e.getMessage());
            }
        }
    }
}

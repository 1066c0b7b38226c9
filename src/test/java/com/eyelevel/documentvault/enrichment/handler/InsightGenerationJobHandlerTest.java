package com.eyelevel.documentvault.enrichment.handler;

import com.eyelevel.documentvault.enrichment.insight.InsightEngine;
import com.eyelevel.documentvault.exception.apiclient.BadRequestException;
import com.eyelevel.documentvault.exception.apiclient.ServiceUnavailableException;
import com.eyelevel.documentvault.job.JobPayload;
import com.eyelevel.documentvault.job.JobSubmitter;
import com.eyelevel.documentvault.job.JobType;
import com.eyelevel.documentvault.job.TestJobs;
import com.eyelevel.documentvault.model.DocumentInsight;
import com.eyelevel.documentvault.model.DocumentRecord;
import com.eyelevel.documentvault.storage.StorageType;
import com.eyelevel.documentvault.support.InMemoryMetadataStore;
import com.eyelevel.documentvault.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("InsightGenerationJobHandler")
class InsightGenerationJobHandlerTest {

    @Mock
    private InsightEngine insightEngine;

    @Mock
    private JobSubmitter submitter;

    private InMemoryMetadataStore metadataStore;
    private InsightGenerationJobHandler handler;
    private DocumentRecord record;

    @BeforeEach
    void setUp() {
        metadataStore = new InMemoryMetadataStore();
        handler = new InsightGenerationJobHandler(metadataStore, insightEngine, TestFixtures.jsonSerializer());
        record = metadataStore.createDocument(DocumentRecord.builder().userId("u1").fileName("w2.pdf")
                                                            .mimeType("application/pdf").storageKey("u1/t/w2.pdf")
                                                            .storageType(StorageType.LOCAL)
                                                            .extractedText("Wages 52,000").build());
    }

    private void run() {
        handler.handle(TestJobs.activeJob(JobType.INSIGHT_GENERATION,
                                          new JobPayload(record.getId(), "u1", record.getStorageKey(),
                                                         record.getMimeType())), submitter);
    }

    @Test
    @DisplayName("Should replace the insights stored on the record")
    void storesInsights() {
        metadataStore.updateDocument(record.getId(), current -> current.setInsights("[]"));
        when(insightEngine.isAvailable()).thenReturn(true);
        when(insightEngine.generateInsights("w2.pdf", "Wages 52,000", "application/pdf")).thenReturn(
                List.of(new DocumentInsight("income", "Annual wages", "Wages of 52,000 reported", 0.92, "high")));

        run();

        String insights = metadataStore.getDocument(record.getId()).orElseThrow().getInsights();
        DocumentInsight[] parsed = TestFixtures.jsonParser().parseObject(insights, DocumentInsight[].class);
        assertThat(Arrays.asList(parsed)).singleElement().satisfies(insight -> {
            assertThat(insight.type()).isEqualTo("income");
            assertThat(insight.confidence()).isEqualTo(0.92);
        });
    }

    @Test
    void skipsWhenEngineUnavailable() {
        when(insightEngine.isAvailable()).thenReturn(false);

        run();

        verify(insightEngine, never()).generateInsights(anyString(),
                                                        anyString(),
                                                        anyString());
    }

    @Test
    void skipsWithoutExtractedText() {
        metadataStore.updateDocument(record.getId(), current -> current.setExtractedText(null));
        when(insightEngine.isAvailable()).thenReturn(true);

        run();

        assertThat(metadataStore.getDocument(record.getId()).orElseThrow().getInsights()).isNull();
    }

    @Test
    @DisplayName("Should rethrow transient service errors so the job is retried")
    void rethrowsTransientErrors() {
        when(insightEngine.isAvailable()).thenReturn(true);
        when(insightEngine.generateInsights("w2.pdf", "Wages 52,000", "application/pdf"))
                .thenThrow(new ServiceUnavailableException("down"));

        assertThatThrownBy(this::run).isInstanceOf(ServiceUnavailableException.class);
    }

    @Test
    void completesOnRejectedRequest() {
        when(insightEngine.isAvailable()).thenReturn(true);
        when(insightEngine.generateInsights("w2.pdf", "Wages 52,000", "application/pdf"))
                .thenThrow(new BadRequestException("text too long"));

        run();

        assertThat(metadataStore.getDocument(record.getId()).orElseThrow().getInsights()).isNull();
    }
}

package com.eyelevel.documentvault.enrichment.insight;

import com.eyelevel.documentvault.model.DocumentInsight;

import java.util.List;

/**
 * Derives structured insights from extracted document text.
 */
public interface InsightEngine {

    /**
     * @return {@code false} when insight generation is switched off for this deployment.
     */
    boolean isAvailable();

    List<DocumentInsight> generateInsights(String documentName, String text, String mimeType);
}

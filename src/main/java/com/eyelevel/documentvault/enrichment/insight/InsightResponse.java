package com.eyelevel.documentvault.enrichment.insight;

import com.eyelevel.documentvault.model.DocumentInsight;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record InsightResponse(List<DocumentInsight> insights) {
}

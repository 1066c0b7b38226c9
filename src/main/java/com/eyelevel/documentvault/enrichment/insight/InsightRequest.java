package com.eyelevel.documentvault.enrichment.insight;

public record InsightRequest(String documentName, String mimeType, String content) {
}

package com.eyelevel.documentvault.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One finding produced by the insight engine for a document.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DocumentInsight(String type, String title, String content, Double confidence, String priority) {
}

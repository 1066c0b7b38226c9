package com.eyelevel.documentvault.job;

/**
 * Kinds of background work run after a document is stored.
 */
public enum JobType {
    TEXT_EXTRACTION,
    INSIGHT_GENERATION,
    THUMBNAIL
}

package com.eyelevel.documentvault.model;

/**
 * Outcome of normalizing an upload to its canonical format.
 */
public enum ConversionStatus {
    NOT_REQUIRED,
    CONVERTED,
    /**
     * Conversion failed and the original bytes were stored instead.
     */
    FAILED_ORIGINAL_KEPT
}

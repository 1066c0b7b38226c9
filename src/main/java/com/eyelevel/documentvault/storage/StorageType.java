package com.eyelevel.documentvault.storage;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The storage backends a deployment can select with {@code app.storage.type}.
 */
public enum StorageType {
    LOCAL,
    CLOUD;

    /**
     * @return the lower-case name used in persisted metadata.
     */
    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static StorageType fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

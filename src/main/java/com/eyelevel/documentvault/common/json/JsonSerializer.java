package com.eyelevel.documentvault.common.json;

/**
 * Serializes Java objects to JSON.
 *
 * <p>Implementations report every failure as
 * {@link com.eyelevel.documentvault.exception.json.JsonParsingException}.
 */
public interface JsonSerializer {

    <T> String serialize(T object);
}

package com.eyelevel.documentvault.common.json;

/**
 * Parses JSON into Java objects.
 *
 * <p>Implementations wrap a concrete JSON library and report every failure as
 * {@link com.eyelevel.documentvault.exception.json.JsonParsingException}.
 */
public interface JsonParser {

    <T> T parseObject(String json, Class<T> valueType);

    <T> T parseObject(byte[] jsonBytes, Class<T> valueType);
}

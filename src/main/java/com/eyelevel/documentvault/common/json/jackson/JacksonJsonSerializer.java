package com.eyelevel.documentvault.common.json.jackson;

import com.eyelevel.documentvault.common.json.JsonSerializer;
import com.eyelevel.documentvault.exception.json.JsonParsingException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link JsonSerializer} backed by the application's Jackson {@link ObjectMapper}.
 */
@Component("jacksonJsonSerializer")
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonSerializer implements JsonSerializer {

    private final ObjectMapper objectMapper;

    @Override
    public <T> String serialize(T object) {
        try {
            return objectMapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            log.error("Error serializing object of type {}", object == null ? "null" : object.getClass().getName(), e);
            throw new JsonParsingException("Error serializing object to JSON", e);
        }
    }
}

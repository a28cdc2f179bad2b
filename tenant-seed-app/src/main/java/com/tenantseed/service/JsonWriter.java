package com.tenantseed.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/**
 * Serializes settings documents and genetics panels for TEXT columns.
 */
@Component
public class JsonWriter {

    private final ObjectMapper objectMapper;

    public JsonWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new JsonWriteException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public static class JsonWriteException extends RuntimeException {
        public JsonWriteException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}

package com.riskcast.backend.service.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.riskcast.backend.model.EnsembleResult;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;

@Component
public class EnsembleResultCodec {

    private final ObjectMapper objectMapper;

    public EnsembleResultCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public String encodeResult(EnsembleResult result) {
        return write(result);
    }

    public EnsembleResult decodeResult(String json) {
        return read(json, EnsembleResult.class);
    }

    public String encodePayload(CachedPayload payload) {
        return write(payload);
    }

    public CachedPayload decodePayload(String json) {
        return read(json, CachedPayload.class);
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T read(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }
}

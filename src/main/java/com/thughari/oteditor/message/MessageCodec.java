package com.thughari.oteditor.message;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * JSON encoding of {@link CollabMessage}. Decoding never throws: anything malformed is logged
 * and comes back empty so the caller can drop it without touching the document.
 */
@Slf4j
public class MessageCodec {

    private final ObjectMapper objectMapper;

    public MessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(CollabMessage message) throws JsonProcessingException {
        return objectMapper.writeValueAsString(message);
    }

    public Optional<CollabMessage> decode(String json) {
        CollabMessage message;
        try {
            message = objectMapper.readValue(json, CollabMessage.class);
        } catch (JsonProcessingException e) {
            log.warn("Dropping undecodable message: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        if (message == null || message.getPayload() == null) {
            log.warn("Dropping message without payload: {}", json);
            return Optional.empty();
        }
        if (!message.getPayload().wellFormed()) {
            log.warn("Dropping message with incomplete {} payload: {}", message.getPayload().getClass().getSimpleName(), json);
            return Optional.empty();
        }
        return Optional.of(message);
    }
}

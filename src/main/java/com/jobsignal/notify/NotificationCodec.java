package com.jobsignal.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Optional;

/**
 * JSON encoding of {@link NotificationMessage}. Payloads that are not job notifications decode to
 * empty so callers can route them elsewhere.
 */
public class NotificationCodec {

    private final ObjectMapper objectMapper;

    public NotificationCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public byte[] encode(NotificationMessage message) {
        try {
            return objectMapper.writeValueAsBytes(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode notification for job " + message.jobId(), e);
        }
    }

    public Optional<NotificationMessage> decode(byte[] payload) {
        if (payload == null || payload.length == 0) {
            return Optional.empty();
        }
        try {
            JsonNode tree = objectMapper.readTree(payload);
            if (tree == null || !tree.isObject()
                    || !tree.path("job_id").canConvertToLong()
                    || !tree.path("last_modified_at").isTextual()
                    || !tree.path("fingerprint").isTextual()) {
                return Optional.empty();
            }
            return Optional.of(new NotificationMessage(
                    tree.get("job_id").asLong(),
                    tree.get("last_modified_at").asText(),
                    tree.get("fingerprint").asText()));
        } catch (IOException e) {
            return Optional.empty();
        }
    }
}

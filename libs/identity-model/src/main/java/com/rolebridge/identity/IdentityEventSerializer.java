package com.rolebridge.identity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON serialization for {@link IdentityEvent}, used by the durable pending-event store.
 *
 * <p>{@code JavaTimeModule} writes {@code Instant} as ISO 8601. Unknown properties are ignored so
 * rows written by a newer release can still be read.
 */
public final class IdentityEventSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private IdentityEventSerializer() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Serializes an identity event to a JSON string.
     *
     * @throws IdentitySerializationException if serialization fails
     */
    public static String serialize(IdentityEvent event) {
        try {
            return MAPPER.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IdentitySerializationException(
                    "Failed to serialize identity event: " + event.eventId(), e);
        }
    }

    /**
     * Deserializes a JSON string to an identity event.
     *
     * @throws IdentitySerializationException if the JSON is malformed
     */
    public static IdentityEvent deserialize(String json) {
        try {
            return MAPPER.readValue(json, IdentityEvent.class);
        } catch (JsonProcessingException e) {
            throw new IdentitySerializationException("Failed to deserialize identity event", e);
        }
    }

    /** Exception thrown when identity event serialization or deserialization fails. */
    public static class IdentitySerializationException extends RuntimeException {
        public IdentitySerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}

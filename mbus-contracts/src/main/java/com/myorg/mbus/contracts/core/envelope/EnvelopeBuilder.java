package com.myorg.mbus.contracts.core.envelope;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.mbus.contracts.core.conventions.CoreHeaders;
import com.myorg.mbus.contracts.core.conventions.HeaderTimestamps;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Fluent construction of an {@link Envelope}. Pure: no I/O and no validation beyond
 * payload serialization.
 */
public class EnvelopeBuilder {
    private static final ObjectMapper DEFAULT_MAPPER = new ObjectMapper().findAndRegisterModules();

    private String key;
    private byte[] payload;
    private final Map<String, String> headers = new HashMap<>();
    private Instant timestamp = Instant.now();
    private JsonProcessingException serializationError;

    EnvelopeBuilder() {}

    // same metadata shape for every event a service emits
    public static Envelope wrap(ObjectMapper mapper,
                                String key,
                                String eventType,
                                String correlationId,
                                String source,
                                Object value) {
        return new EnvelopeBuilder()
                .key(key)
                .value(mapper, value)
                .eventType(eventType)
                .correlationId(correlationId)
                .source(source)
                .build();
    }

    public EnvelopeBuilder key(String key) {
        this.key = key;
        return this;
    }

    public EnvelopeBuilder payload(byte[] raw) {
        this.payload = raw;
        this.serializationError = null;
        return this;
    }

    public EnvelopeBuilder value(Object value) {
        return value(DEFAULT_MAPPER, value);
    }

    public EnvelopeBuilder value(ObjectMapper mapper, Object value) {
        try {
            this.payload = mapper.writeValueAsBytes(value);
            this.serializationError = null;
        } catch (JsonProcessingException e) {
            this.payload = null;
            this.serializationError = e;
        }
        return this;
    }

    public EnvelopeBuilder header(String name, String value) {
        headers.put(name, value);
        return this;
    }

    /** A blank id is replaced by a random UUID. */
    public EnvelopeBuilder eventId(String eventId) {
        headers.put(CoreHeaders.EVENT_ID,
                (eventId == null || eventId.isBlank()) ? UUID.randomUUID().toString() : eventId);
        return this;
    }

    public EnvelopeBuilder eventType(String eventType) {
        return header(CoreHeaders.EVENT_TYPE, eventType);
    }

    public EnvelopeBuilder correlationId(String correlationId) {
        return header(CoreHeaders.CORRELATION_ID, correlationId);
    }

    public EnvelopeBuilder conversationId(String conversationId) {
        return header(CoreHeaders.CONVERSATION_ID, conversationId);
    }

    public EnvelopeBuilder schemaVersion(String schemaVersion) {
        return header(CoreHeaders.SCHEMA_VERSION, schemaVersion);
    }

    public EnvelopeBuilder source(String source) {
        return header(CoreHeaders.SOURCE, source);
    }

    public EnvelopeBuilder timestamp(Instant timestamp) {
        this.timestamp = timestamp;
        return this;
    }

    /**
     * @throws EnvelopeBuildException if a value passed to {@link #value(Object)} could not be serialized
     */
    public Envelope build() {
        if (serializationError != null) {
            throw new EnvelopeBuildException("payload serialization failed: " + serializationError.getOriginalMessage(),
                    serializationError);
        }

        Map<String, String> h = new HashMap<>(headers);
        h.values().removeIf(v -> v == null);

        String eventId = h.get(CoreHeaders.EVENT_ID);
        if (eventId == null || eventId.isEmpty()) {
            h.put(CoreHeaders.EVENT_ID, UUID.randomUUID().toString());
        }

        Instant ts = timestamp == null ? Instant.now() : timestamp;
        String tsHeader = h.get(CoreHeaders.TIMESTAMP);
        if (tsHeader == null || tsHeader.isEmpty()) {
            h.put(CoreHeaders.TIMESTAMP, HeaderTimestamps.format(ts));
        }

        Envelope env = new Envelope(key, payload, h);
        env.setTimestamp(ts);
        return env;
    }
}

package com.myorg.mbus.contracts.core.envelope;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.mbus.contracts.core.conventions.CoreHeaders;
import com.myorg.mbus.contracts.core.exception.MbusNonRetryableException;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.io.IOException;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A message on the bus: partition key, opaque payload and string headers.
 * <p>
 * Partition and offset are only populated on the consume path. Topic is the source topic when
 * consuming and the target topic inside producer interceptors.
 */
@Getter
@ToString(exclude = "payload")
public class Envelope {
    private final String key;
    private final byte[] payload;
    private final Map<String, String> headers;

    @Setter private String topic;
    @Setter private int partition = -1;
    @Setter private long offset = -1L;
    @Setter private Instant timestamp;

    public Envelope(String key, byte[] payload, Map<String, String> headers) {
        this.key = key;
        this.payload = payload;
        this.headers = headers == null ? new HashMap<>() : new HashMap<>(headers);
    }

    public static EnvelopeBuilder builder() {
        return new EnvelopeBuilder();
    }

    public boolean hasKey() {
        return key != null && !key.isEmpty();
    }

    public boolean hasPayload() {
        return payload != null && payload.length > 0;
    }

    public Optional<String> header(String name) {
        return Optional.ofNullable(headers.get(name));
    }

    public Envelope putHeader(String name, String value) {
        headers.put(name, value);
        return this;
    }

    public String eventId() {
        return headers.get(CoreHeaders.EVENT_ID);
    }

    public String eventType() {
        return headers.get(CoreHeaders.EVENT_TYPE);
    }

    public String correlationId() {
        return headers.get(CoreHeaders.CORRELATION_ID);
    }

    public String conversationId() {
        return headers.get(CoreHeaders.CONVERSATION_ID);
    }

    /** Parsed retry-count header; 0 when the header is missing or not a decimal integer. */
    public int retryCount() {
        String raw = headers.get(CoreHeaders.RETRY_COUNT);
        if (raw == null || raw.isBlank()) return 0;
        try {
            int n = Integer.parseInt(raw.trim());
            return Math.max(n, 0);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    public int incrementRetryCount() {
        int next = retryCount() + 1;
        headers.put(CoreHeaders.RETRY_COUNT, Integer.toString(next));
        return next;
    }

    public <T> T decodePayload(ObjectMapper mapper, Class<T> type) {
        try {
            return mapper.readValue(payload, type);
        } catch (IOException e) {
            throw new MbusNonRetryableException("DESERIALIZATION",
                    "deserialization failed for eventId=" + eventId(), e);
        }
    }

    /** Copy with its own header map; key and payload are shared. */
    public Envelope copy() {
        Envelope c = new Envelope(key, payload, headers);
        c.topic = topic;
        c.partition = partition;
        c.offset = offset;
        c.timestamp = timestamp;
        return c;
    }
}

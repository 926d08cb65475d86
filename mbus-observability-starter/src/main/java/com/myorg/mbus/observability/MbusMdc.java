package com.myorg.mbus.observability;

import com.myorg.mbus.contracts.core.envelope.Envelope;
import org.slf4j.MDC;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * MDC keys set around a publish or handle call. {@link #put} returns what it replaced so a
 * nested call (a handler that publishes) hands the outer values back on {@link #restore}.
 */
public final class MbusMdc {
    private MbusMdc() {}

    public static final String EVENT_ID = "eventId";
    public static final String EVENT_TYPE = "eventType";
    public static final String CORRELATION_ID = "corrId";
    public static final String TOPIC = "topic";
    public static final String PARTITION = "partition";
    public static final String OFFSET = "offset";

    static final List<String> KEYS = List.of(EVENT_ID, EVENT_TYPE, CORRELATION_ID, TOPIC, PARTITION, OFFSET);

    public static Map<String, String> put(Envelope env, String topic) {
        Map<String, String> previous = new HashMap<>();
        for (String k : KEYS) {
            previous.put(k, MDC.get(k));
        }
        if (env == null) return previous;

        set(EVENT_ID, env.eventId());
        set(EVENT_TYPE, env.eventType());
        set(CORRELATION_ID, env.correlationId());
        set(TOPIC, topic);
        if (env.getPartition() >= 0) {
            set(PARTITION, String.valueOf(env.getPartition()));
            set(OFFSET, String.valueOf(env.getOffset()));
        } else {
            MDC.remove(PARTITION);
            MDC.remove(OFFSET);
        }
        return previous;
    }

    public static void restore(Map<String, String> previous) {
        for (String k : KEYS) {
            String v = previous == null ? null : previous.get(k);
            if (v == null) MDC.remove(k);
            else MDC.put(k, v);
        }
    }

    public static void clear() {
        KEYS.forEach(MDC::remove);
    }

    private static void set(String key, String value) {
        if (value == null) MDC.remove(key);
        else MDC.put(key, value);
    }
}

package com.myorg.mbus.kafka.pipeline;

import com.myorg.mbus.contracts.core.context.BusContext;
import com.myorg.mbus.contracts.core.envelope.Envelope;
import com.myorg.mbus.contracts.core.handler.MessageHandler;

/**
 * Cross-cutting wrapper around a publish or a handler call. Implementations either call
 * {@code next} (and observe its outcome) or short-circuit by returning or throwing.
 * <p>
 * Key and payload must be left untouched.
 */
@FunctionalInterface
public interface MessageInterceptor {
    void intercept(BusContext ctx, Envelope envelope, MessageHandler next) throws Exception;

    /** Consulted when the client factory registers interceptor beans. */
    default boolean appliesTo(Side side) {
        return true;
    }
}

package com.myorg.mbus.contracts.core.handler;

import com.myorg.mbus.contracts.core.context.BusContext;
import com.myorg.mbus.contracts.core.envelope.Envelope;

/**
 * Application callback for a consumed message. Returning normally means the message
 * was handled; throwing hands the failure to the retry policy.
 */
@FunctionalInterface
public interface MessageHandler {
    void handle(BusContext ctx, Envelope envelope) throws Exception;
}

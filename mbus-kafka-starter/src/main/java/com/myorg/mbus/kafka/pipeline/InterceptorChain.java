package com.myorg.mbus.kafka.pipeline;

import com.myorg.mbus.contracts.core.handler.MessageHandler;

import java.util.List;

public final class InterceptorChain {
    private InterceptorChain() {}

    /**
     * Wraps {@code terminal} so that {@code interceptors.get(0)} runs outermost.
     * The list is read once; later changes to it do not affect the returned handler.
     */
    public static MessageHandler compose(List<? extends MessageInterceptor> interceptors, MessageHandler terminal) {
        MessageHandler handler = terminal;
        for (int i = interceptors.size() - 1; i >= 0; i--) {
            MessageInterceptor interceptor = interceptors.get(i);
            MessageHandler next = handler;
            handler = (ctx, env) -> interceptor.intercept(ctx, env, next);
        }
        return handler;
    }
}

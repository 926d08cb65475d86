package com.myorg.mbus.observability;

import com.myorg.mbus.contracts.core.context.BusContext;
import com.myorg.mbus.contracts.core.envelope.Envelope;
import com.myorg.mbus.contracts.core.handler.MessageHandler;
import com.myorg.mbus.kafka.pipeline.MessageInterceptor;
import com.myorg.mbus.kafka.pipeline.Side;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.core.Ordered;

/** Times each call and counts it as success or fail. One instance per side. */
@RequiredArgsConstructor
public class MetricsInterceptor implements MessageInterceptor, Ordered {

    public static final int ORDER = LoggingInterceptor.ORDER + 100;

    private final MbusMetrics metrics;
    private final Side side;

    @Override
    public boolean appliesTo(Side s) {
        return s == side;
    }

    @Override
    public void intercept(BusContext ctx, Envelope env, MessageHandler next) throws Exception {
        Timer.Sample sample = metrics.startTimer();
        try {
            next.handle(ctx, env);
            metrics.incSuccess(side);
            metrics.stopTimer(sample, side, env.getTopic(), "success");
        } catch (Exception e) {
            metrics.incFail(side);
            metrics.stopTimer(sample, side, env.getTopic(), "fail");
            throw e;
        }
    }

    @Override
    public int getOrder() {
        return ORDER;
    }
}

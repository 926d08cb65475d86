package com.myorg.mbus.observability;

import com.myorg.mbus.contracts.core.context.BusContext;
import com.myorg.mbus.contracts.core.envelope.Envelope;
import com.myorg.mbus.contracts.core.handler.MessageHandler;
import com.myorg.mbus.kafka.pipeline.MessageInterceptor;
import com.myorg.mbus.kafka.pipeline.Side;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;

import java.time.Duration;
import java.util.Map;

/**
 * Logs each publish or handle call with the envelope's ids and the call duration. The ids
 * are in the MDC while the call runs.
 */
@Slf4j
public class LoggingInterceptor implements MessageInterceptor, Ordered {

    public static final int ORDER = Ordered.HIGHEST_PRECEDENCE + 100;

    private final Side side;
    private final MbusObservabilityProperties props;

    public LoggingInterceptor(Side side, MbusObservabilityProperties props) {
        this.side = side;
        this.props = props;
    }

    @Override
    public boolean appliesTo(Side s) {
        return s == side;
    }

    @Override
    public void intercept(BusContext ctx, Envelope env, MessageHandler next) throws Exception {
        Map<String, String> previous = props.isMdcEnabled() ? MbusMdc.put(env, env.getTopic()) : null;
        long start = System.nanoTime();
        try {
            if (side == Side.PRODUCER) {
                log.debug("Publishing message topic={} key={} eventId={} corrId={}",
                        env.getTopic(), env.getKey(), env.eventId(), env.correlationId());
            } else {
                log.debug("Processing message topic={} partition={} offset={} key={} eventId={} corrId={}",
                        env.getTopic(), env.getPartition(), env.getOffset(), env.getKey(), env.eventId(), env.correlationId());
            }

            next.handle(ctx, env);

            log.debug("{} message key={} eventId={} duration={}",
                    side == Side.PRODUCER ? "Published" : "Processed", env.getKey(), env.eventId(), since(start));
        } catch (Exception e) {
            log.warn("Failed to {} message topic={} partition={} offset={} key={} eventId={} corrId={} duration={} error={}",
                    side == Side.PRODUCER ? "publish" : "process", env.getTopic(), env.getPartition(), env.getOffset(),
                    env.getKey(), env.eventId(), env.correlationId(), since(start), e.getMessage());
            throw e;
        } finally {
            if (previous != null) {
                MbusMdc.restore(previous);
            }
        }
    }

    private static Duration since(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    @Override
    public int getOrder() {
        return ORDER;
    }
}

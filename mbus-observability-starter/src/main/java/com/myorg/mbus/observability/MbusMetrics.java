package com.myorg.mbus.observability;

import com.myorg.mbus.kafka.pipeline.Side;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for publish and consume calls, plus the consume loop's retry and
 * dead-letter decisions. One instance per application, passed to whoever records.
 */
@RequiredArgsConstructor
public class MbusMetrics {

    public static final String PUBLISH_SUCCESS = "mbus.publish.success";
    public static final String PUBLISH_FAIL = "mbus.publish.fail";
    public static final String PUBLISH_DURATION = "mbus.publish.duration";
    public static final String CONSUME_SUCCESS = "mbus.consume.success";
    public static final String CONSUME_FAIL = "mbus.consume.fail";
    public static final String CONSUME_DURATION = "mbus.consume.duration";
    public static final String CONSUME_RETRY = "mbus.consume.retry";
    public static final String CONSUME_DLQ = "mbus.consume.dlq";
    public static final String CONSUME_DLQ_FAILED = "mbus.consume.dlq_failed";
    public static final String CONSUME_DROPPED = "mbus.consume.dropped";
    public static final String CONSUME_UNROUTED = "mbus.consume.unrouted";

    private final MeterRegistry registry;
    private final String serviceName;
    private final MbusObservabilityProperties props;

    // base meters, created up front so they show up before the first message
    private Counter cPublishSuccess;
    private Counter cPublishFail;
    private Counter cConsumeSuccess;
    private Counter cConsumeFail;
    private Counter cRetry;
    private Counter cDlq;
    private Counter cDlqFailed;
    private Counter cDropped;
    private Counter cUnrouted;

    /** Call once on startup. */
    public void preRegisterBaseMeters() {
        cPublishSuccess = counter(PUBLISH_SUCCESS);
        cPublishFail = counter(PUBLISH_FAIL);
        cConsumeSuccess = counter(CONSUME_SUCCESS);
        cConsumeFail = counter(CONSUME_FAIL);
        cRetry = counter(CONSUME_RETRY);
        cDlq = counter(CONSUME_DLQ);
        cDlqFailed = counter(CONSUME_DLQ_FAILED);
        cDropped = counter(CONSUME_DROPPED);
        cUnrouted = counter(CONSUME_UNROUTED);

        Timer.builder(PUBLISH_DURATION).tag("service", serviceName).register(registry);
        Timer.builder(CONSUME_DURATION).tag("service", serviceName).register(registry);
    }

    private Counter counter(String name) {
        return Counter.builder(name).tag("service", serviceName).register(registry);
    }

    public Timer.Sample startTimer() {
        return Timer.start(registry);
    }

    public void stopTimer(Timer.Sample sample, Side side, String topic, String outcome) {
        if (sample == null) return;

        Timer.Builder b = Timer.builder(side == Side.PRODUCER ? PUBLISH_DURATION : CONSUME_DURATION)
                .tag("service", serviceName)
                .tag("outcome", outcome);
        if (props.isTagTopic() && topic != null && !topic.isBlank()) b.tag("topic", topic);

        sample.stop(b.register(registry));
    }

    public void incSuccess(Side side) {
        inc(side == Side.PRODUCER ? cPublishSuccess : cConsumeSuccess);
    }

    public void incFail(Side side) {
        inc(side == Side.PRODUCER ? cPublishFail : cConsumeFail);
    }

    public void incRetry()      { inc(cRetry); }
    public void incDlq()        { inc(cDlq); }
    public void incDlqFailed()  { inc(cDlqFailed); }
    public void incDropped()    { inc(cDropped); }
    public void incUnrouted()   { inc(cUnrouted); }

    private static void inc(Counter c) {
        if (c != null) c.increment();
    }

    /** Point-in-time totals; averages cover successful and failed calls alike. */
    public Snapshot snapshot() {
        return new Snapshot(
                count(cPublishSuccess), count(cPublishFail), average(PUBLISH_DURATION),
                count(cConsumeSuccess), count(cConsumeFail), average(CONSUME_DURATION),
                count(cRetry), count(cDlq), count(cDlqFailed), count(cDropped), count(cUnrouted));
    }

    /** Successful publishes per second over {@code elapsed}. */
    public double publishRate(Duration elapsed) {
        return rate(count(cPublishSuccess), elapsed);
    }

    public double consumeRate(Duration elapsed) {
        return rate(count(cConsumeSuccess), elapsed);
    }

    private static double rate(long n, Duration elapsed) {
        if (elapsed.isZero() || elapsed.isNegative()) return 0;
        return n / (elapsed.toNanos() / 1e9);
    }

    private static long count(Counter c) {
        return c == null ? 0 : (long) c.count();
    }

    private Duration average(String timerName) {
        long calls = 0;
        double totalNanos = 0;
        for (Timer t : registry.find(timerName).tag("service", serviceName).timers()) {
            calls += t.count();
            totalNanos += t.totalTime(TimeUnit.NANOSECONDS);
        }
        return calls == 0 ? Duration.ZERO : Duration.ofNanos((long) (totalNanos / calls));
    }

    public record Snapshot(long published,
                           long publishFailed,
                           Duration avgPublishDuration,
                           long consumed,
                           long consumeFailed,
                           Duration avgConsumeDuration,
                           long retries,
                           long deadLettered,
                           long deadLetterFailed,
                           long dropped,
                           long unrouted) {}
}

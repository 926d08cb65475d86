package com.demo.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.mbus.contracts.core.context.BusContext;
import com.myorg.mbus.contracts.core.envelope.Envelope;
import com.myorg.mbus.contracts.core.envelope.EnvelopeBuilder;
import com.myorg.mbus.kafka.MbusKafkaAutoConfiguration;
import com.myorg.mbus.kafka.error.BrokerException;
import com.myorg.mbus.kafka.error.DeadLetterPublishException;
import com.myorg.mbus.kafka.error.InvalidEnvelopeException;
import com.myorg.mbus.kafka.error.ProducerClosedException;
import com.myorg.mbus.kafka.producer.MbusProducer;
import com.myorg.mbus.observability.MbusMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;

@Slf4j
@RestController
public class BookingsController {

    private final MbusProducer commands;
    private final ObjectMapper mapper;
    private final MbusKafkaAutoConfiguration.MbusKafkaMarker marker;
    private final ObjectProvider<MbusMetrics> metrics;

    public BookingsController(@Qualifier("commands") MbusProducer commands,
                              ObjectMapper mapper,
                              MbusKafkaAutoConfiguration.MbusKafkaMarker marker,
                              ObjectProvider<MbusMetrics> metrics) {
        this.commands = commands;
        this.mapper = mapper;
        this.marker = marker;
        this.metrics = metrics;
    }

    /**
     * Publishes a booking command keyed by {@code key}; commands for the same key are
     * handled in order. Use {@code simulate=transient} in params to watch retries and the DLQ.
     */
    @PostMapping("/bookings/commands")
    public Map<String, String> send(@RequestParam(name = "action", defaultValue = "create_booking") String action,
                                    @RequestParam(name = "key", defaultValue = "booking-1") String key,
                                    @RequestBody(required = false) Map<String, Object> params) {
        String correlationId = UUID.randomUUID().toString();
        BookingCommand cmd = BookingCommand.builder().action(action).params(params).build();
        Envelope env = EnvelopeBuilder.wrap(mapper, key, BookingCommand.EVENT_TYPE, correlationId,
                BookingCommandHandler.SOURCE, cmd);
        try {
            commands.publish(BusContext.background().withTimeout(Duration.ofSeconds(10)), env);
        } catch (InvalidEnvelopeException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        } catch (BrokerException | DeadLetterPublishException | ProducerClosedException e) {
            log.error("Send failed for eventId={} error={}", env.eventId(), e.getMessage());
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Send failed: " + e.getMessage(), e);
        }
        return Map.of("eventId", env.eventId(), "correlationId", correlationId, "key", key);
    }

    @GetMapping("/bookings/messaging")
    public Map<String, Object> messaging() {
        MbusMetrics m = metrics.getIfAvailable();
        return Map.of(
                "brokers", marker.brokers(),
                "metrics", m == null ? "disabled" : m.snapshot());
    }
}

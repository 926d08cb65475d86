package com.demo.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.mbus.contracts.core.context.BusContext;
import com.myorg.mbus.contracts.core.envelope.Envelope;
import com.myorg.mbus.contracts.core.envelope.EnvelopeBuilder;
import com.myorg.mbus.contracts.core.exception.MbusBusinessException;
import com.myorg.mbus.contracts.core.exception.MbusRetryableException;
import com.myorg.mbus.contracts.core.handler.MessageHandler;
import com.myorg.mbus.kafka.producer.MbusProducer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;

/**
 * Handles booking commands and answers on the results topic, keyed by correlation id.
 * <p>
 * Demo failure switches: {@code params.simulate=transient} fails with a retryable error,
 * an unknown action is a business rejection.
 */
@Slf4j
@Component
public class BookingCommandHandler implements MessageHandler {

    static final String SOURCE = "bookings-service";

    private final ObjectMapper mapper;
    private final MbusProducer results;
    private final Environment springEnv;

    public BookingCommandHandler(ObjectMapper mapper,
                                 @Qualifier("results") MbusProducer results,
                                 Environment springEnv) {
        this.mapper = mapper;
        this.results = results;
        this.springEnv = springEnv;
    }

    @Override
    public void handle(BusContext ctx, Envelope envelope) {
        BookingCommand cmd = envelope.decodePayload(mapper, BookingCommand.class);
        Map<String, Object> params = cmd.getParams() == null ? Map.of() : cmd.getParams();

        if ("transient".equals(params.get("simulate"))) {
            log.warn("FORCED FAIL on port={} eventId={} retry={}",
                    springEnv.getProperty("server.port"), envelope.eventId(), envelope.retryCount());
            throw new MbusRetryableException("inventory service timeout for eventId=" + envelope.eventId());
        }

        BookingResult result = switch (cmd.getAction() == null ? "" : cmd.getAction()) {
            case "create_booking" -> BookingResult.builder()
                    .bookingId(String.valueOf(params.getOrDefault("bookingId", "booking-" + UUID.randomUUID())))
                    .status("created")
                    .build();
            case "cancel_booking" -> BookingResult.builder()
                    .bookingId(String.valueOf(params.get("bookingId")))
                    .status("cancelled")
                    .build();
            default -> throw new MbusBusinessException("unknown action: " + cmd.getAction());
        };

        String correlationId = envelope.correlationId() != null ? envelope.correlationId() : envelope.eventId();
        Envelope reply = EnvelopeBuilder.wrap(mapper, correlationId, BookingResult.EVENT_TYPE, correlationId, SOURCE, result);
        results.publish(ctx, reply);

        log.info("HANDLED action={} bookingId={} eventId={} corrId={}",
                cmd.getAction(), result.getBookingId(), envelope.eventId(), correlationId);
    }
}

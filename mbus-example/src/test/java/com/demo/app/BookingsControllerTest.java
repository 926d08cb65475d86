package com.demo.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.mbus.contracts.core.context.BusContext;
import com.myorg.mbus.contracts.core.envelope.Envelope;
import com.myorg.mbus.kafka.MbusKafkaAutoConfiguration;
import com.myorg.mbus.kafka.error.BrokerException;
import com.myorg.mbus.kafka.error.DeadLetterPublishException;
import com.myorg.mbus.kafka.error.InvalidEnvelopeException;
import com.myorg.mbus.kafka.error.ProducerClosedException;
import com.myorg.mbus.kafka.producer.MbusProducer;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

class BookingsControllerTest {

    private final MbusProducer commands = mock(MbusProducer.class);

    @SuppressWarnings("unchecked")
    private final BookingsController controller = new BookingsController(commands, new ObjectMapper(),
            new MbusKafkaAutoConfiguration.MbusKafkaMarker(List.of("localhost:9092")),
            mock(ObjectProvider.class));

    private void publishFailsWith(RuntimeException e) {
        doThrow(e).when(commands).publish(any(BusContext.class), any(Envelope.class));
    }

    private HttpStatus statusOfSend() {
        Throwable thrown = catchThrowable(
                () -> controller.send("create_booking", "booking-1", Map.of()));
        assertThat(thrown).isInstanceOf(ResponseStatusException.class);
        return HttpStatus.valueOf(((ResponseStatusException) thrown).getStatusCode().value());
    }

    @Test
    void acceptedCommandReturnsIds() {
        Map<String, String> body = controller.send("create_booking", "booking-1", Map.of("bookingId", "b-1"));

        assertThat(body).containsEntry("key", "booking-1").containsKeys("eventId", "correlationId");
    }

    @Test
    void invalidEnvelopeIsBadRequest() {
        publishFailsWith(new InvalidEnvelopeException(InvalidEnvelopeException.Reason.EMPTY_KEY));

        assertThat(statusOfSend()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void brokerFailureIsServiceUnavailable() {
        publishFailsWith(new BrokerException("write failed", new RuntimeException("broker down")));

        assertThat(statusOfSend()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    }

    @Test
    void deadLetterFailureIsServiceUnavailable() {
        publishFailsWith(new DeadLetterPublishException(new RuntimeException("dlq down"),
                new RuntimeException("broker down")));

        assertThat(statusOfSend()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    }

    @Test
    void closedProducerIsServiceUnavailable() {
        publishFailsWith(new ProducerClosedException("pipeline-executor-to-bookings"));

        assertThatThrownBy(() -> controller.send("create_booking", "booking-1", null))
                .isInstanceOfSatisfying(ResponseStatusException.class,
                        e -> assertThat(e.getReason()).isEqualTo("Send failed: producer is closed: topic=pipeline-executor-to-bookings"));
    }

    @Test
    void messagingReportsDisabledMetricsWithoutRegistry() {
        Map<String, Object> body = controller.messaging();

        assertThat(body).containsEntry("brokers", List.of("localhost:9092")).containsEntry("metrics", "disabled");
    }
}

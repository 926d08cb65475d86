package com.myorg.mbus.kafka.error;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.myorg.mbus.contracts.core.exception.ErrorKind;
import com.myorg.mbus.contracts.core.exception.MbusProcessingException;
import org.apache.kafka.common.errors.RetriableException;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.errors.UnknownTopicOrPartitionException;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeoutException;

// Order: explicit kind > known exception types > message text > PERMANENT.
// Unknown failures are not retried.
public class DefaultErrorClassifier implements ErrorClassifier {

    static final List<String> TRANSIENT_PATTERNS = List.of(
            "connection refused",
            "timeout",
            "deadline exceeded",
            "no such host",
            "network is unreachable",
            "broken pipe",
            "connection reset",
            "i/o timeout",
            "temporary failure"
    );

    static final List<String> PERMANENT_PATTERNS = List.of(
            "invalid message",
            "schema mismatch",
            "deserialization failed",
            "unknown topic",
            "invalid configuration"
    );

    private static final int MAX_DEPTH = 32;

    @Override
    public ErrorKind classify(Throwable error) {
        if (error == null) return ErrorKind.UNKNOWN;

        List<Throwable> chain = causeChain(error);

        for (Throwable t : chain) {
            if (t instanceof MbusProcessingException mpe) {
                return mpe.getKind();
            }
        }

        for (Throwable t : chain) {
            // Kafka marks this retriable, but a missing topic does not appear by retrying in place
            if (t instanceof UnknownTopicOrPartitionException) return ErrorKind.PERMANENT;
            if (t instanceof SerializationException || t instanceof JsonProcessingException) return ErrorKind.PERMANENT;
            if (t instanceof RetriableException
                    || t instanceof TimeoutException
                    || t instanceof SocketTimeoutException
                    || t instanceof ConnectException) {
                return ErrorKind.TRANSIENT;
            }
        }

        String text = describe(chain);
        for (String p : TRANSIENT_PATTERNS) {
            if (text.contains(p)) return ErrorKind.TRANSIENT;
        }
        for (String p : PERMANENT_PATTERNS) {
            if (text.contains(p)) return ErrorKind.PERMANENT;
        }
        return ErrorKind.PERMANENT;
    }

    private static List<Throwable> causeChain(Throwable error) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        List<Throwable> out = new ArrayList<>();
        Throwable t = error;
        while (t != null && out.size() < MAX_DEPTH && seen.add(t)) {
            out.add(t);
            t = t.getCause();
        }
        return out;
    }

    private static String describe(List<Throwable> chain) {
        StringBuilder sb = new StringBuilder();
        for (Throwable t : chain) {
            if (t.getMessage() != null) {
                sb.append(t.getMessage()).append('\n');
            }
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }
}

package com.myorg.mbus.contracts.core.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Failure that carries an explicit {@link ErrorKind}. The classifier trusts this kind
 * instead of guessing from the message text.
 */
public class MbusProcessingException extends RuntimeException {

    private final ErrorKind kind;
    private final String detailMessage;
    private final Map<String, Object> details = new LinkedHashMap<>();

    public MbusProcessingException(ErrorKind kind, String message) {
        this(kind, message, null);
    }

    public MbusProcessingException(ErrorKind kind, String message, Throwable cause) {
        super(render(message, cause), cause);
        this.kind = kind == null ? ErrorKind.UNKNOWN : kind;
        this.detailMessage = message;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /** Message without the cause suffix. */
    public String getDetailMessage() {
        return detailMessage;
    }

    public MbusProcessingException withDetail(String key, Object value) {
        details.put(key, value);
        return this;
    }

    public Map<String, Object> getDetails() {
        return Collections.unmodifiableMap(details);
    }

    private static String render(String message, Throwable cause) {
        if (cause == null || cause.getMessage() == null) return message;
        return message + ": " + cause.getMessage();
    }
}

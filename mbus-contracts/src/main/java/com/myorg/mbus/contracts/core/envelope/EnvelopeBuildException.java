package com.myorg.mbus.contracts.core.envelope;

public class EnvelopeBuildException extends RuntimeException {
    public EnvelopeBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}

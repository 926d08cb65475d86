package com.myorg.mbus.contracts.core.exception;

public class MbusRetryableException extends MbusProcessingException {
    public MbusRetryableException(String msg) { super(ErrorKind.TRANSIENT, msg); }
    public MbusRetryableException(String msg, Throwable cause) { super(ErrorKind.TRANSIENT, msg, cause); }
}

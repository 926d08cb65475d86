package com.myorg.mbus.contracts.core.exception;

/** Application-level rejection of a message, e.g. a booking for a closed business unit. */
public class MbusBusinessException extends MbusProcessingException {
    public MbusBusinessException(String msg) { super(ErrorKind.BUSINESS, msg); }
    public MbusBusinessException(String msg, Throwable cause) { super(ErrorKind.BUSINESS, msg, cause); }
}

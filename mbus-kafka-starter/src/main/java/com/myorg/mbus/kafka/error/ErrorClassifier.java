package com.myorg.mbus.kafka.error;

import com.myorg.mbus.contracts.core.exception.ErrorKind;

/**
 * Decides what kind of failure a handler or broker error is. Applications may expose their
 * own bean to replace the default.
 */
public interface ErrorClassifier {

    /** Never returns null; a null error is {@link ErrorKind#UNKNOWN}. */
    ErrorKind classify(Throwable error);
}

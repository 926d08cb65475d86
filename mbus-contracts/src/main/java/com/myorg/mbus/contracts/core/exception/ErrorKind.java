package com.myorg.mbus.contracts.core.exception;

public enum ErrorKind {
    /** Expected to clear on retry (connectivity blips, timeouts). */
    TRANSIENT,
    /** Retrying will not help (malformed or incompatible payload). */
    PERMANENT,
    /** Explicit application-level rejection. Never retried. */
    BUSINESS,
    UNKNOWN
}

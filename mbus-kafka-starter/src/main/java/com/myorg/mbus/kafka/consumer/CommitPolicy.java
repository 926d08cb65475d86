package com.myorg.mbus.kafka.consumer;

public enum CommitPolicy {
    /** Commit every fetched record whatever the outcome. A failed dead-letter write loses the message. */
    ALWAYS,
    /** Hold the offset when the dead-letter write fails, so the record is fetched again. */
    ON_TERMINAL_SUCCESS
}

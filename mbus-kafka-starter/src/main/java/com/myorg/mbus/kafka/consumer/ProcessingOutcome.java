package com.myorg.mbus.kafka.consumer;

public enum ProcessingOutcome {
    SUCCEEDED,
    DEAD_LETTERED,
    /** Terminal failure and the dead-letter write failed too. */
    DEAD_LETTER_FAILED,
    /** Business rejection discarded under {@link BusinessErrorPolicy#DROP}. */
    DROPPED,
    /** Terminal failure with no dead-letter topic configured. */
    UNROUTED
}

package com.myorg.mbus.contracts.core.conventions;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/** RFC 3339 rendering used for the timestamp and dlq-timestamp headers. */
public final class HeaderTimestamps {
    private HeaderTimestamps() {}

    public static String format(Instant instant) {
        return DateTimeFormatter.ISO_INSTANT.format(instant.truncatedTo(ChronoUnit.SECONDS));
    }
}

package com.myorg.mbus.kafka.broker;

import java.util.Locale;

/**
 * Where a group with no committed offset starts reading: {@code newest}, {@code oldest}
 * or an explicit offset applied to every partition.
 */
public record StartOffset(Kind kind, long offset) {

    public enum Kind { NEWEST, OLDEST, EXPLICIT }

    public static final StartOffset NEWEST = new StartOffset(Kind.NEWEST, -1L);
    public static final StartOffset OLDEST = new StartOffset(Kind.OLDEST, -2L);

    public static StartOffset parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("start offset is empty");
        }
        String v = raw.trim().toLowerCase(Locale.ROOT);
        switch (v) {
            case "newest", "latest", "-1":
                return NEWEST;
            case "oldest", "earliest", "-2":
                return OLDEST;
            default:
                long n;
                try {
                    n = Long.parseLong(v);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("start offset must be newest, oldest or >= 0, got: " + raw);
                }
                if (n < 0) {
                    throw new IllegalArgumentException("start offset must be newest, oldest or >= 0, got: " + raw);
                }
                return new StartOffset(Kind.EXPLICIT, n);
        }
    }

    /** Value for {@code auto.offset.reset}; explicit offsets fall back to earliest before the seek. */
    public String autoOffsetReset() {
        return kind == Kind.NEWEST ? "latest" : "earliest";
    }
}

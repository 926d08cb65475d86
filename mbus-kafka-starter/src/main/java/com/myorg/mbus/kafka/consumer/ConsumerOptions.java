package com.myorg.mbus.kafka.consumer;

import java.time.Duration;

public record ConsumerOptions(int maxRetries,
                              Duration fetchErrorBackoff,
                              CommitPolicy commitPolicy,
                              BusinessErrorPolicy businessErrorPolicy) {

    public static ConsumerOptions defaults() {
        return new ConsumerOptions(3, Duration.ofSeconds(1), CommitPolicy.ALWAYS, BusinessErrorPolicy.DEAD_LETTER);
    }
}

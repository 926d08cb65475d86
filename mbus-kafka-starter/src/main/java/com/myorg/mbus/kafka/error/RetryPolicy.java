package com.myorg.mbus.kafka.error;

import com.myorg.mbus.contracts.core.exception.ErrorKind;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public class RetryPolicy {

    private final ErrorClassifier classifier;

    /** Only transient failures are retried, and only while the budget lasts. */
    public boolean shouldRetry(Throwable error, int currentRetries, int maxRetries) {
        if (error == null) return false;
        if (currentRetries >= maxRetries) return false;
        return classifier.classify(error) == ErrorKind.TRANSIENT;
    }
}

package org.pak.retry.core;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Duration;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
class RetryDecision {
    private static final RetryDecision STOP = new RetryDecision(false, 0, Duration.ZERO);

    boolean retry;
    int attempt;
    Duration delay;

    static RetryDecision stop() {
        return STOP;
    }

    static RetryDecision retry(int attempt, Duration delay) {
        return new RetryDecision(true, attempt, delay);
    }
}

package org.pak.retry.core;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.FieldDefaults;

import java.time.Duration;

@Builder
@FieldDefaults(makeFinal = true, level = lombok.AccessLevel.PRIVATE)
@Getter
public class RetryConfig {
    //used in log messages and as MDC value
    @NonNull
    @Builder.Default
    String name = "retry";
    //max number of retries after the first attempt, <= 0 disables retrying
    @Builder.Default
    int maxAttempts = RetryPolicy.DEFAULT_MAX_ATTEMPTS;
    //pause before each retry, zero or negative means RetryPolicy.DEFAULT_DELAY
    @Builder.Default
    Duration delay = Duration.ZERO;
}

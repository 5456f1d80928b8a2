package org.pak.retry.core;

public interface RetryableFilter {
    boolean isRetryable(Exception exception);
}

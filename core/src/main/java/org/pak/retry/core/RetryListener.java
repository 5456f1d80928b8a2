package org.pak.retry.core;

/**
 * Callback fired once per granted retry, after the delay and before the next attempt.
 */
public interface RetryListener {
    /**
     * @param exception failure of the previous attempt
     * @param attempt   1-based index of the retry about to start
     */
    void onRetry(Exception exception, int attempt);
}

package org.pak.retry.core;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.pak.retry.core.error.IncorrectStateException;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Re-invokes an operation until it succeeds, the retry budget is spent or a failure is rejected by the filters.
 * <p>
 * {@code maxAttempts} counts retries, not invocations: an operation that always fails is invoked
 * {@code maxAttempts + 1} times. Filters are combined with OR, no filters means every {@link Exception} is
 * retryable. The failure that stops the sequence is rethrown as is.
 * <p>
 * Configuration is append-only and must be done before execution. An instance is not thread safe: it can be
 * reused sequentially, the retry counter is reset when an execution starts, but two executions must not overlap.
 */
@Slf4j
public final class RetryPolicy {
    public static final int DEFAULT_MAX_ATTEMPTS = 5;
    public static final Duration DEFAULT_DELAY = Duration.ofMillis(1000);
    static final String POLICY_MDC_KEY = "retryPolicy";

    @Getter
    private final String name;
    @Getter
    private final int maxAttempts;
    @Getter
    private final Duration delay;
    private final List<RetryableFilter> filters = new ArrayList<>();
    private final List<RetryListener> listeners = new ArrayList<>();
    private final AtomicBoolean isRunning = new AtomicBoolean(false);
    private int attemptsUsed = 0;

    private RetryPolicy(String name, int maxAttempts, Duration delay) {
        this.name = name;
        this.maxAttempts = maxAttempts;
        this.delay = delay;
    }

    public static RetryPolicy create() {
        return create(DEFAULT_MAX_ATTEMPTS);
    }

    public static RetryPolicy create(int maxAttempts) {
        return create(maxAttempts, Duration.ZERO);
    }

    public static RetryPolicy create(int maxAttempts, Duration delay) {
        return create(RetryConfig.builder()
                .maxAttempts(maxAttempts)
                .delay(delay)
                .build());
    }

    public static RetryPolicy create(@NonNull RetryConfig config) {
        return new RetryPolicy(config.getName(), config.getMaxAttempts(), config.getDelay());
    }

    public RetryPolicy filter(@NonNull RetryableFilter filter) {
        filters.add(filter);
        return this;
    }

    /**
     * Retries failures that are instances of {@code exceptionClass}.
     */
    public <E extends Exception> RetryPolicy filter(@NonNull Class<E> exceptionClass) {
        return filter(new TypedRetryableFilter<>(exceptionClass));
    }

    /**
     * Retries failures that are instances of {@code exceptionClass} and accepted by {@code refinement}.
     */
    public <E extends Exception> RetryPolicy filter(
            @NonNull Class<E> exceptionClass,
            @NonNull Predicate<? super E> refinement
    ) {
        return filter(new TypedRetryableFilter<>(exceptionClass, refinement));
    }

    public RetryPolicy onRetry(@NonNull RetryListener listener) {
        listeners.add(listener);
        return this;
    }

    /**
     * Delay actually used between attempts: the configured one, or {@link #DEFAULT_DELAY} when it is unset,
     * zero or negative.
     */
    public Duration getEffectiveDelay() {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return DEFAULT_DELAY;
        }

        return delay;
    }

    /**
     * Number of retries performed by the current or the last execution.
     */
    public int getAttemptsUsed() {
        return attemptsUsed;
    }

    public void reset() {
        attemptsUsed = 0;
    }

    /**
     * Runs the operation on the caller thread, sleeping between attempts.
     * <p>
     * If the thread is interrupted while waiting, the interrupt flag is restored and the failure of the last
     * attempt is thrown.
     *
     * @return the value of the first successful attempt
     * @throws Exception the failure of the last attempt, or the failure of a filter or a listener
     */
    public <T> T run(@NonNull Callable<T> operation) throws Exception {
        if (maxAttempts <= 0) {
            return operation.call();
        }

        begin();
        var outerPolicy = MDC.get(POLICY_MDC_KEY);
        MDC.put(POLICY_MDC_KEY, name);
        try {
            while (true) {
                try {
                    return operation.call();
                } catch (Exception e) {
                    var decision = decide(e);
                    if (!decision.isRetry()) {
                        throw e;
                    }

                    try {
                        TimeUnit.NANOSECONDS.sleep(decision.getDelay().toNanos());
                    } catch (InterruptedException ie) {
                        log.warn("Retry policy {} is interrupted before attempt {}", name, decision.getAttempt());
                        Thread.currentThread().interrupt();
                        throw e;
                    }

                    notifyListeners(e, decision.getAttempt());
                }
            }
        } finally {
            if (outerPolicy == null) {
                MDC.remove(POLICY_MDC_KEY);
            } else {
                MDC.put(POLICY_MDC_KEY, outerPolicy);
            }
            isRunning.set(false);
        }
    }

    public <T> CompletableFuture<T> runAsync(@NonNull Supplier<? extends CompletionStage<T>> operation) {
        return runAsync(operation, RetryScheduler.shared());
    }

    /**
     * Runs the operation without blocking the caller: delays are scheduled on {@code scheduler}, listeners and
     * the following attempts run on its thread.
     * <p>
     * An operation that throws instead of returning a stage, or returns {@code null}, counts as a failed attempt.
     * An {@link Error} is never retried, it fails the returned future.
     * The returned future fails with the original failure, not with a {@link CompletionException} around it.
     */
    public <T> CompletableFuture<T> runAsync(
            @NonNull Supplier<? extends CompletionStage<T>> operation,
            @NonNull ScheduledExecutorService scheduler
    ) {
        var result = new CompletableFuture<T>();

        if (maxAttempts <= 0) {
            invoke(operation).whenComplete((value, throwable) -> complete(result, value, unwrap(throwable)));
            return result;
        }

        begin();
        try {
            attempt(operation, scheduler, result);
        } catch (RuntimeException | Error e) {
            finish(result, null, e);
        }
        return result;
    }

    private <T> void attempt(
            Supplier<? extends CompletionStage<T>> operation,
            ScheduledExecutorService scheduler,
            CompletableFuture<T> result
    ) {
        invoke(operation).whenComplete((value, throwable) -> {
            if (throwable == null) {
                finish(result, value, null);
                return;
            }

            var failure = unwrap(throwable);
            if (!(failure instanceof Exception)) {
                finish(result, null, failure);
                return;
            }

            var exception = (Exception) failure;
            RetryDecision decision;
            try {
                decision = decide(exception);
            } catch (RuntimeException | Error e) {
                finish(result, null, e);
                return;
            }

            if (!decision.isRetry()) {
                finish(result, null, exception);
                return;
            }

            try {
                scheduler.schedule(() -> {
                    try {
                        notifyListeners(exception, decision.getAttempt());
                        attempt(operation, scheduler, result);
                    } catch (RuntimeException | Error e) {
                        finish(result, null, e);
                    }
                }, decision.getDelay().toNanos(), TimeUnit.NANOSECONDS);
            } catch (RejectedExecutionException e) {
                log.error("Retry policy {} cannot schedule attempt {}", name, decision.getAttempt(), e);
                finish(result, null, e);
            }
        });
    }

    RetryDecision decide(Exception exception) {
        if (!isRetryable(exception)) {
            log.debug("Non retryable exception occurred in {}: {}", name, exception.toString());
            return RetryDecision.stop();
        }

        if (attemptsUsed < maxAttempts) {
            attemptsUsed++;
            var wait = getEffectiveDelay();
            log.warn("Retryable exception occurred in {}, attempt {} of {}, retry in {}: {}",
                    name, attemptsUsed, maxAttempts, wait, exception.toString());
            return RetryDecision.retry(attemptsUsed, wait);
        }

        log.debug("Retry budget of {} is exhausted in {}", maxAttempts, name);
        return RetryDecision.stop();
    }

    boolean isRetryable(Exception exception) {
        return filters.isEmpty() || filters.stream().anyMatch(filter -> filter.isRetryable(exception));
    }

    private void notifyListeners(Exception exception, int attempt) {
        listeners.forEach(listener -> listener.onRetry(exception, attempt));
    }

    private void begin() {
        if (!isRunning.compareAndSet(false, true)) {
            throw new IncorrectStateException("Retry policy " + name + " is already executing");
        }

        attemptsUsed = 0;
    }

    private <T> void finish(CompletableFuture<T> result, T value, Throwable failure) {
        isRunning.set(false);
        complete(result, value, failure);
    }

    private static <T> void complete(CompletableFuture<T> result, T value, Throwable failure) {
        if (failure == null) {
            result.complete(value);
        } else {
            result.completeExceptionally(failure);
        }
    }

    private static <T> CompletionStage<T> invoke(Supplier<? extends CompletionStage<T>> operation) {
        try {
            CompletionStage<T> stage = operation.get();
            if (stage == null) {
                return CompletableFuture.failedFuture(
                        new NullPointerException("Operation returned null instead of a completion stage"));
            }

            return stage;
        } catch (Throwable t) {
            return CompletableFuture.failedFuture(t);
        }
    }

    private static Throwable unwrap(Throwable throwable) {
        var current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }

        return current;
    }
}

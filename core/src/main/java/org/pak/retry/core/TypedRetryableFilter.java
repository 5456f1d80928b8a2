package org.pak.retry.core;

import lombok.NonNull;

import java.util.function.Predicate;

public class TypedRetryableFilter<E extends Exception> implements RetryableFilter {
    private final Class<E> exceptionClass;
    private final Predicate<? super E> refinement;

    public TypedRetryableFilter(@NonNull Class<E> exceptionClass) {
        this(exceptionClass, exception -> true);
    }

    public TypedRetryableFilter(@NonNull Class<E> exceptionClass, @NonNull Predicate<? super E> refinement) {
        this.exceptionClass = exceptionClass;
        this.refinement = refinement;
    }

    @Override
    public boolean isRetryable(Exception exception) {
        if (!exceptionClass.isInstance(exception)) {
            return false;
        }

        return refinement.test(exceptionClass.cast(exception));
    }
}

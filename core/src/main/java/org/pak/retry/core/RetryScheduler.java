package org.pak.retry.core;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

final class RetryScheduler {
    private static final ScheduledExecutorService SHARED = Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder()
                    .setNameFormat("retry-scheduler-%d")
                    .setDaemon(true)
                    .build());

    private RetryScheduler() {
    }

    static ScheduledExecutorService shared() {
        return SHARED;
    }
}

package com.smurthy.ai.chatrouter.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a blocking backend call on the backend pool and waits for it with a deadline.
 *
 * A call that misses its deadline is cancelled with interruption and reported as a
 * {@link TimeoutException}. Failures inside the call arrive as an {@link ExecutionException}
 * whose cause is the underlying error. If the waiting thread itself is interrupted the call is
 * cancelled and {@link CycleCancelledException} is thrown.
 */
@Component
public class BackendCallExecutor {

    private static final Logger log = LoggerFactory.getLogger(BackendCallExecutor.class);

    private final ExecutorService executor;

    public BackendCallExecutor(@Qualifier("backendCallExecutorService") ExecutorService executor) {
        this.executor = executor;
    }

    public <T> T call(String operation, Callable<T> task, Duration deadline)
            throws TimeoutException, ExecutionException {
        Future<T> future;
        try {
            future = executor.submit(task);
        } catch (RejectedExecutionException e) {
            throw new ExecutionException(operation + " call rejected by the backend pool", e);
        }

        try {
            return future.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} call exceeded its {}ms deadline and was cancelled", operation, deadline.toMillis());
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CycleCancelledException(operation + " call cancelled by caller", e);
        }
    }
}

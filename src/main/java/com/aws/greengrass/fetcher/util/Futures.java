/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.util;

import java.util.Collection;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Combinators for the {@link CompletableFuture}s handed out by fetch operations.
 */
public final class Futures {

    private Futures() {
    }

    /**
     * Run a task that may throw checked exceptions on the given executor. Whatever the task throws becomes the
     * exceptional result of the returned future as is, without a {@link CompletionException} around it.
     *
     * @param task     task to run
     * @param executor executor to run the task on
     * @param <T>      result type
     * @return future holding the task result
     */
    @SuppressWarnings("PMD.AvoidCatchingThrowable")
    public static <T> CompletableFuture<T> supplyAsync(CrashableSupplier<T, ? extends Exception> task,
                                                       Executor executor) {
        CompletableFuture<T> future = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                try {
                    future.complete(task.apply());
                } catch (Throwable t) {
                    future.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(e);
        }
        return future;
    }

    /**
     * Mirror the outcome of a future, stripping the {@link CompletionException} wrappers that chained stages add
     * around the original failure.
     *
     * @param source future to mirror
     * @param <T>    result type
     * @return a future completing like source, with the unwrapped cause on failure
     */
    public static <T> CompletableFuture<T> unwrapped(CompletableFuture<T> source) {
        CompletableFuture<T> result = new CompletableFuture<>();
        source.whenComplete((value, t) -> {
            if (t == null) {
                result.complete(value);
            } else {
                result.completeExceptionally(unwrap(t));
            }
        });
        return result;
    }

    /**
     * Wait for every future, then complete. If any of them failed, the result fails with the failure that happened
     * first; the others are still awaited so that nothing is left running when the result is observed.
     *
     * @param futures futures to join
     * @return future that completes once all given futures did
     */
    public static CompletableFuture<Void> allOfFailFast(Collection<? extends CompletableFuture<?>> futures) {
        if (futures.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> result = new CompletableFuture<>();
        AtomicInteger remaining = new AtomicInteger(futures.size());
        AtomicReference<Throwable> firstFailure = new AtomicReference<>();
        for (CompletableFuture<?> future : futures) {
            future.whenComplete((value, t) -> {
                if (t != null) {
                    firstFailure.compareAndSet(null, unwrap(t));
                }
                if (remaining.decrementAndGet() == 0) {
                    Throwable failure = firstFailure.get();
                    if (failure == null) {
                        result.complete(null);
                    } else {
                        result.completeExceptionally(failure);
                    }
                }
            });
        }
        return result;
    }

    /**
     * Strip {@link CompletionException} and {@link ExecutionException} wrappers.
     *
     * @param t throwable
     * @return the innermost wrapped cause
     */
    public static Throwable unwrap(Throwable t) {
        Throwable cause = t;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}

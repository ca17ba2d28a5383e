/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.internal;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

import dev.timber.TimberContext;

/**
 * Runs independent tasks on a context's worker pool and collects their results in task order.
 */
public final class ParallelTasks {

    private ParallelTasks() {
    }

    /**
     * Run all tasks and wait for them. A runtime exception thrown by a task is
     * rethrown unwrapped to the caller once all tasks have completed.
     */
    @SuppressWarnings("unchecked")
    public static <R> List<R> invokeAll(List<Supplier<R>> tasks, TimberContext context) {
        CompletableFuture<R>[] futures = new CompletableFuture[tasks.size()];
        for (int i = 0; i < futures.length; i++) {
            futures[i] = CompletableFuture.supplyAsync(tasks.get(i), context.executor());
        }
        try {
            CompletableFuture.allOf(futures).join();
        }
        catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            if (e.getCause() instanceof Error error) {
                throw error;
            }
            throw e;
        }
        List<R> results = new ArrayList<>(futures.length);
        for (CompletableFuture<R> future : futures) {
            results.add(future.join());
        }
        return results;
    }
}

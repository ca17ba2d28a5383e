/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Context object that owns the worker pool used for bulk column transforms.
 * <p>
 * CSV type inference, CSV column formatting and {@code Series.map} run on
 * this pool, one task per column or per chunk. Readers and writers create
 * and close a private context when none is passed to them.
 * </p>
 * <pre>{@code
 * try (TimberContext context = TimberContext.create()) {
 *     DataFrame frame = CsvReader.of(path).withContext(context).read();
 *     // ...
 * }
 * }</pre>
 */
public final class TimberContext implements AutoCloseable {

    private static final String THREADS_PROPERTY = "timber.threads";

    private static final System.Logger LOG = System.getLogger(TimberContext.class.getName());

    private final ExecutorService executor;
    private final int parallelism;

    private TimberContext(ExecutorService executor, int parallelism) {
        this.executor = executor;
        this.parallelism = parallelism;
    }

    /**
     * Create a new context with a thread pool sized to available processors,
     * or to the {@code timber.threads} system property when set.
     */
    public static TimberContext create() {
        return create(configuredThreads());
    }

    /**
     * Create a new context with a thread pool of the specified size.
     */
    public static TimberContext create(int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("Thread count must be positive but was " + threads);
        }
        AtomicInteger threadCounter = new AtomicInteger(0);
        ThreadFactory threadFactory = r -> {
            Thread t = new Thread(r, "timber-" + threadCounter.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
        ExecutorService executor = Executors.newFixedThreadPool(threads, threadFactory);
        LOG.log(System.Logger.Level.DEBUG, "Created context with {0} worker threads", threads);
        return new TimberContext(executor, threads);
    }

    private static int configuredThreads() {
        String configured = System.getProperty(THREADS_PROPERTY);
        if (configured == null || configured.isBlank()) {
            return Runtime.getRuntime().availableProcessors();
        }
        try {
            return Integer.parseInt(configured.trim());
        }
        catch (NumberFormatException e) {
            LOG.log(System.Logger.Level.WARNING, "Ignoring invalid value ''{0}'' of {1}", configured, THREADS_PROPERTY);
            return Runtime.getRuntime().availableProcessors();
        }
    }

    /**
     * Get the executor service for parallel operations.
     */
    public ExecutorService executor() {
        return executor;
    }

    /**
     * Number of worker threads, used to size chunks of parallel transforms.
     */
    public int parallelism() {
        return parallelism;
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            executor.awaitTermination(5, TimeUnit.SECONDS);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}

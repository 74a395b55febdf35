/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitswood.reader;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Context object that manages shared resources for FITS decoding.
 * <p>
 * Holds the thread pool used for parallel ASCII table row decoding.
 * </p>
 * <p>
 * The context lifecycle is tied to either:
 * <ul>
 *   <li>the caller, when passed to {@link FitsFileReader#readAll(java.nio.file.Path, FitsContext)}</li>
 *   <li>a single {@link FitsFileReader#readAll(java.nio.file.Path)} call, which creates and closes its own</li>
 * </ul>
 * </p>
 */
public final class FitsContext implements AutoCloseable {

    static final String THREADS_PROPERTY = "fitswood.threads";
    static final String ROWS_PER_TASK_PROPERTY = "fitswood.rowsPerTask";

    private static final int DEFAULT_ROWS_PER_TASK = 4096;

    private static final System.Logger LOG = System.getLogger(FitsContext.class.getName());

    private final ExecutorService executor;
    private final int threads;
    private final int rowsPerTask;

    private FitsContext(ExecutorService executor, int threads, int rowsPerTask) {
        this.executor = executor;
        this.threads = threads;
        this.rowsPerTask = rowsPerTask;
    }

    /**
     * Create a new context with a thread pool sized by the {@code fitswood.threads}
     * system property, defaulting to the number of available processors.
     */
    public static FitsContext create() {
        int threads = Integer.getInteger(THREADS_PROPERTY, Runtime.getRuntime().availableProcessors());
        return create(threads);
    }

    /**
     * Create a new context with a thread pool of the specified size.
     */
    public static FitsContext create(int threads) {
        return create(threads, Integer.getInteger(ROWS_PER_TASK_PROPERTY, DEFAULT_ROWS_PER_TASK));
    }

    /**
     * Create a new context with a thread pool of the specified size, splitting
     * table decoding into tasks of at most {@code rowsPerTask} rows.
     */
    public static FitsContext create(int threads, int rowsPerTask) {
        if (threads < 1) {
            throw new IllegalArgumentException("Thread count must be positive: " + threads);
        }
        if (rowsPerTask < 1) {
            throw new IllegalArgumentException("Rows per task must be positive: " + rowsPerTask);
        }
        AtomicInteger threadCounter = new AtomicInteger(0);
        ThreadFactory threadFactory = r -> {
            Thread t = new Thread(r, "fitswood-" + threadCounter.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
        ExecutorService executor = Executors.newFixedThreadPool(threads, threadFactory);
        LOG.log(System.Logger.Level.DEBUG, "Created context with {0} threads, {1} rows per task", threads, rowsPerTask);
        return new FitsContext(executor, threads, rowsPerTask);
    }

    /**
     * Get the executor service for parallel operations.
     */
    public ExecutorService executor() {
        return executor;
    }

    public int threads() {
        return threads;
    }

    /**
     * Maximum number of table rows decoded by one parallel task.
     */
    public int rowsPerTask() {
        return rowsPerTask;
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

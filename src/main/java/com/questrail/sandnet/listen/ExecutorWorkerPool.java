package com.questrail.sandnet.listen;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * {@link WorkerPool} backed by an {@link ExecutorService}.
 */
public final class ExecutorWorkerPool implements WorkerPool {

    private final ExecutorService executor;

    public ExecutorWorkerPool(ExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public static ExecutorWorkerPool fixed(int threads) {
        return new ExecutorWorkerPool(Executors.newFixedThreadPool(threads));
    }

    @Override
    public void submit(Runnable task) {
        executor.execute(task);
    }

    @Override
    public void shutdown() {
        executor.shutdown();
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }
}

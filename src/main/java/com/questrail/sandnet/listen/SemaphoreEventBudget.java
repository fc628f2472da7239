package com.questrail.sandnet.listen;

import java.util.concurrent.Semaphore;

/**
 * {@link EventBudget} backed by a {@link Semaphore}.
 */
public final class SemaphoreEventBudget implements EventBudget {

    private final Semaphore permits;

    public SemaphoreEventBudget(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        this.permits = new Semaphore(limit);
    }

    @Override
    public int available() {
        return permits.availablePermits();
    }

    @Override
    public boolean tryAcquire() {
        return permits.tryAcquire();
    }

    @Override
    public void release() {
        permits.release();
    }
}

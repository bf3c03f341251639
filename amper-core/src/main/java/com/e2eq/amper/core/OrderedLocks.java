package com.e2eq.amper.core;

import java.util.concurrent.locks.Lock;

/**
 * Holds a registry lock and a container lock, always taken registry first and released in
 * reverse order. Every operation that needs both goes through {@link #acquire(Lock, Lock)}.
 */
final class OrderedLocks implements AutoCloseable {

    private final Lock registryLock;
    private final Lock containerLock;

    private OrderedLocks(Lock registryLock, Lock containerLock) {
        this.registryLock = registryLock;
        this.containerLock = containerLock;
    }

    static OrderedLocks acquire(Lock registryLock, Lock containerLock) {
        registryLock.lock();
        try {
            containerLock.lock();
        } catch (RuntimeException | Error e) {
            registryLock.unlock();
            throw e;
        }
        return new OrderedLocks(registryLock, containerLock);
    }

    @Override
    public void close() {
        try {
            containerLock.unlock();
        } finally {
            registryLock.unlock();
        }
    }
}

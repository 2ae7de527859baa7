package com.quantdesk.backend.compute.pipeline;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per dataset name; a whole application pass runs under it so concurrent passes on the
 * same dataset cannot interleave their reload/write steps.
 */
@Component
public class DatasetLockRegistry {

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String dataset, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(dataset, key -> new ReentrantLock(true));
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public boolean isLocked(String dataset) {
        ReentrantLock lock = locks.get(dataset);
        return lock != null && lock.isLocked();
    }
}

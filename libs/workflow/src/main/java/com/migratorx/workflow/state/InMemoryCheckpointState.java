package com.migratorx.workflow.state;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Non-durable {@link CheckpointState} for local runs, dry runs and tests.
 */
public final class InMemoryCheckpointState implements CheckpointState {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<CheckpointKey, Object> values = new HashMap<>();
    private final Set<String> completed = new HashSet<>();

    @Override
    public Optional<Object> get(CheckpointKey key) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(values.get(key));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void set(CheckpointKey key, Object value) {
        if (key == null) {
            throw new IllegalArgumentException("key must not be null");
        }
        Object scalar = CheckpointState.requireScalar(value);
        lock.writeLock().lock();
        try {
            values.put(key, scalar);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void markCompleted(String stepName) {
        requireStepName(stepName);
        lock.writeLock().lock();
        try {
            completed.add(stepName);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean isCompleted(String stepName) {
        lock.readLock().lock();
        try {
            return completed.contains(stepName);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Number of recorded values (completion markers excluded). */
    public int size() {
        lock.readLock().lock();
        try {
            return values.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    static void requireStepName(String stepName) {
        if (stepName == null || stepName.isBlank()) {
            throw new IllegalArgumentException("stepName must not be null or blank");
        }
    }
}

package com.sailfish.cloudrpc.repository;

import com.sailfish.cloudrpc.model.OperationId;
import com.sailfish.cloudrpc.model.PendingOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory implementation of the PendingOperationRegistry guarded by a single lock.
 */
public class InMemoryPendingOperationRegistry implements PendingOperationRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPendingOperationRegistry.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<OperationId, PendingOperation<?>> operations = new LinkedHashMap<>();

    @Override
    public void register(PendingOperation<?> operation) {
        Objects.requireNonNull(operation, "operation cannot be null");
        lock.lock();
        try {
            if (operations.containsKey(operation.getId())) {
                throw new IllegalStateException("Operation " + operation.getId() + " is already registered");
            }
            operations.put(operation.getId(), operation);
        } finally {
            lock.unlock();
        }
        log.debug("Registered operation {}", operation.getId());
    }

    @Override
    public Optional<PendingOperation<?>> findById(OperationId id) {
        lock.lock();
        try {
            return Optional.ofNullable(operations.get(id));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<PendingOperation<?>> remove(OperationId id) {
        PendingOperation<?> removed;
        lock.lock();
        try {
            removed = operations.remove(id);
        } finally {
            lock.unlock();
        }
        if (removed == null) {
            log.debug("Operation {} was already removed", id);
        }
        return Optional.ofNullable(removed);
    }

    @Override
    public List<OperationId> findAllIds() {
        lock.lock();
        try {
            return new ArrayList<>(operations.keySet());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return operations.size();
        } finally {
            lock.unlock();
        }
    }
}

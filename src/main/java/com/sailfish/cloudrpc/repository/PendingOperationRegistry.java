package com.sailfish.cloudrpc.repository;

import com.sailfish.cloudrpc.model.OperationId;
import com.sailfish.cloudrpc.model.PendingOperation;

import java.util.List;
import java.util.Optional;

/**
 * Registry of the operations a completion queue has in flight.
 * Implementations must make every mutation mutually exclusive, since records are registered,
 * completed and cancelled from arbitrary threads.
 */
public interface PendingOperationRegistry {

    /**
     * Registers a new in-flight operation.
     *
     * @param operation The record to register.
     * @throws IllegalStateException if an operation with the same ID is already registered.
     */
    void register(PendingOperation<?> operation);

    /**
     * Finds an in-flight operation by its ID.
     *
     * @param id The operation ID.
     * @return An Optional containing the record if it is still in flight, empty otherwise.
     */
    Optional<PendingOperation<?>> findById(OperationId id);

    /**
     * Removes an operation so its completion can be delivered. Only the first caller for a given ID
     * receives the record; later callers receive empty.
     *
     * @param id The operation ID.
     * @return An Optional containing the removed record, or empty if it was already removed.
     */
    Optional<PendingOperation<?>> remove(OperationId id);

    /**
     * @return The IDs of all in-flight operations, oldest first.
     */
    List<OperationId> findAllIds();

    int size();
}

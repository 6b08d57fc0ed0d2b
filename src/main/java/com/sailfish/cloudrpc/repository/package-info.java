/**
 * Defines the registry of in-flight operations, {@link com.sailfish.cloudrpc.repository.PendingOperationRegistry},
 * and its in-memory implementation used by the completion queue.
 */
package com.sailfish.cloudrpc.repository;

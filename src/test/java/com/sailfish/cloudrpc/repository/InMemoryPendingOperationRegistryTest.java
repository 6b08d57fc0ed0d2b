package com.sailfish.cloudrpc.repository;

import com.sailfish.cloudrpc.model.OperationId;
import com.sailfish.cloudrpc.model.PendingOperation;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryPendingOperationRegistryTest {

    private final InMemoryPendingOperationRegistry registry = new InMemoryPendingOperationRegistry();

    private static PendingOperation<String> operation(long id) {
        return new PendingOperation<>(new OperationId(id), (queue, result) -> { });
    }

    @Test
    void registersAndFindsOperations() {
        PendingOperation<String> first = operation(1);
        registry.register(first);
        registry.register(operation(2));

        assertSame(first, registry.findById(new OperationId(1)).orElseThrow());
        assertEquals(Arrays.asList(new OperationId(1), new OperationId(2)), registry.findAllIds());
        assertEquals(2, registry.size());
    }

    @Test
    void removeSucceedsOnlyOnce() {
        registry.register(operation(7));

        assertTrue(registry.remove(new OperationId(7)).isPresent());
        assertTrue(registry.remove(new OperationId(7)).isEmpty());
        assertTrue(registry.findById(new OperationId(7)).isEmpty());
        assertEquals(0, registry.size());
    }

    @Test
    void rejectsDuplicateRegistration() {
        registry.register(operation(3));
        assertThrows(IllegalStateException.class, () -> registry.register(operation(3)));
    }
}

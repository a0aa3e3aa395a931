package com.example.sheetsync.service;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class TableWriteCoordinatorTest {

    private final TableWriteCoordinator coordinator = new TableWriteCoordinator();

    @Test
    void testPopulateIfCurrent_StaleGenerationIsRejected() {
        // Given
        long observed = coordinator.generation("Proyectos");
        coordinator.commit(List.of("proyectos"), () -> { });

        // When
        AtomicBoolean ran = new AtomicBoolean();
        boolean stored = coordinator.populateIfCurrent("Proyectos", observed, () -> ran.set(true));

        // Then
        assertFalse(stored);
        assertFalse(ran.get());
    }

    @Test
    void testPopulateIfCurrent_UnrelatedCommitDoesNotInterfere() {
        // Given
        long observed = coordinator.generation("Proyectos");
        coordinator.commit(List.of("Materiales", "BOM"), () -> { });

        // When
        boolean stored = coordinator.populateIfCurrent("Proyectos", observed, () -> { });

        // Then
        assertTrue(stored);
    }

    @Test
    void testCommit_BlocksPopulateUntilDone() throws Exception {
        // Given
        ExecutorService pool = Executors.newSingleThreadExecutor();
        CountDownLatch insideCommit = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        long observed = coordinator.generation("Actividades");

        try {
            Future<?> writer = pool.submit(() -> coordinator.commit(List.of("Proyectos", "Actividades"), () -> {
                insideCommit.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }));
            assertTrue(insideCommit.await(5, TimeUnit.SECONDS));

            // When
            release.countDown();
            boolean stored = coordinator.populateIfCurrent("Actividades", observed, () -> { });
            writer.get(5, TimeUnit.SECONDS);

            // Then
            assertFalse(stored);
            assertEquals(observed + 1, coordinator.generation("Proyectos"));
        } finally {
            pool.shutdownNow();
        }
    }
}

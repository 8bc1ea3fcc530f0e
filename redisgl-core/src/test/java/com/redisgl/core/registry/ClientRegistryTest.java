package com.redisgl.core.registry;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ClientRegistryTest {

    @Test
    void testAddRemoveAndMembership() {
        ClientRegistry<String> registry = new ClientRegistry<>();

        assertTrue(registry.isEmpty());
        assertTrue(registry.add("a"));
        assertTrue(registry.add("b"));
        assertFalse(registry.add("a"), "duplicate add is ignored");
        assertEquals(2, registry.size());
        assertTrue(registry.contains("a"));

        registry.remove("a");
        assertFalse(registry.contains("a"));
        assertEquals(1, registry.size());
    }

    @Test
    void testRemovingNonMemberThrows() {
        ClientRegistry<String> registry = new ClientRegistry<>();
        registry.add("a");

        assertThrows(IllegalStateException.class, () -> registry.remove("b"));
        registry.remove("a");
        assertThrows(IllegalStateException.class, () -> registry.remove("a"));
    }

    @Test
    void testSnapshotIsOrderedCopy() {
        ClientRegistry<String> registry = new ClientRegistry<>();
        registry.add("c");
        registry.add("a");
        registry.add("b");

        List<String> snapshot = registry.snapshot();
        registry.remove("a");

        assertEquals(List.of("c", "a", "b"), snapshot);
        assertEquals(List.of("c", "b"), registry.snapshot());
    }

    @Test
    void testConcurrentAddsAndRemovesLeaveRegistryEmpty() throws Exception {
        int clients = 64;
        ClientRegistry<Integer> registry = new ClientRegistry<>();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < clients; i++) {
                int id = i;
                futures.add(executor.submit(() -> {
                    start.await();
                    assertTrue(registry.add(id));
                    Thread.yield();
                    registry.remove(id);
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertTrue(registry.isEmpty());
    }

    @Test
    void testForEachBlocksMembershipChanges() throws Exception {
        ClientRegistry<String> registry = new ClientRegistry<>();
        registry.add("a");
        CountDownLatch iterating = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            CompletableFuture<Void> broadcast = CompletableFuture.runAsync(() -> registry.forEach(client -> {
                iterating.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
            }), executor);
            assertTrue(iterating.await(5, TimeUnit.SECONDS));

            CompletableFuture<Boolean> add = CompletableFuture.supplyAsync(() -> registry.add("b"), executor);
            assertThrows(TimeoutException.class, () -> add.get(200, TimeUnit.MILLISECONDS));

            release.countDown();
            broadcast.get(5, TimeUnit.SECONDS);
            assertTrue(add.get(5, TimeUnit.SECONDS));
            assertEquals(2, registry.size());
        } finally {
            executor.shutdownNow();
        }
    }
}

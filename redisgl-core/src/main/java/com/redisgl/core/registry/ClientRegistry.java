package com.redisgl.core.registry;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import lombok.extern.slf4j.Slf4j;

/**
 * Set of live client connections guarded by a single lock.
 *
 * <p>A connection is a member exactly while its handshake has succeeded and its session
 * has not ended. {@link #forEach(Consumer)} holds the lock for the whole iteration, so
 * broadcasts are serialized against connects and disconnects.
 *
 * @param <C> connection handle type; membership uses the handle's {@code equals}
 */
@Slf4j
public class ClientRegistry<C> {

    private final ReentrantLock lock = new ReentrantLock();
    private final Set<C> clients = new LinkedHashSet<>();

    /**
     * @return {@code false} if the connection was already registered
     */
    public boolean add(C connection) {
        lock.lock();
        try {
            boolean added = clients.add(connection);
            if (!added) {
                log.warn("ClientRegistry: connection {} already registered", connection);
            }
            return added;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes a registered connection.
     *
     * @throws IllegalStateException if the connection is not a member
     */
    public void remove(C connection) {
        lock.lock();
        try {
            if (!clients.remove(connection)) {
                throw new IllegalStateException("Connection " + connection + " is not registered");
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs {@code action} on every member while holding the registry lock. The action must
     * not block on another thread that needs this registry.
     */
    public void forEach(Consumer<? super C> action) {
        lock.lock();
        try {
            for (C client : clients) {
                action.accept(client);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Copy of the current members in insertion order.
     */
    public List<C> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(clients);
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(C connection) {
        lock.lock();
        try {
            return clients.contains(connection);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return clients.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }
}

package com.example.CourseRag.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Lazily resolves a shared backend client exactly once.
 *
 * The first caller runs the initializer under a lock; concurrent first callers wait for it.
 * A failed initialization is remembered, so later calls return empty without retrying.
 * After that the handle is read-only.
 */
public final class BackendHandle<T> {

    private static final Logger log = LoggerFactory.getLogger(BackendHandle.class);

    private final String name;
    private final Supplier<T> initializer;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile boolean initialized;
    private volatile T value;

    public BackendHandle(String name, Supplier<T> initializer) {
        this.name = name;
        this.initializer = initializer;
    }

    public static <T> BackendHandle<T> of(String name, T value) {
        return new BackendHandle<>(name, () -> value);
    }

    public static <T> BackendHandle<T> unavailable(String name) {
        return new BackendHandle<>(name, () -> null);
    }

    public Optional<T> get() {
        if (!initialized) {
            lock.lock();
            try {
                if (!initialized) {
                    value = initialize();
                    initialized = true;
                }
            } finally {
                lock.unlock();
            }
        }
        return Optional.ofNullable(value);
    }

    public String name() {
        return name;
    }

    private T initialize() {
        try {
            T resolved = initializer.get();
            if (resolved == null) {
                log.info("Backend '{}' is not configured", name);
            } else {
                log.info("Backend '{}' initialized", name);
            }
            return resolved;
        } catch (RuntimeException e) {
            log.warn("Backend '{}' failed to initialize: {}", name, e.getMessage());
            return null;
        }
    }
}

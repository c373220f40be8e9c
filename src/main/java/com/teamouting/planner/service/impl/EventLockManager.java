package com.teamouting.planner.service.impl;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.teamouting.planner.config.EngineProperties;
import com.teamouting.planner.exception.EventBusyException;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes writes per event within this instance.
 *
 * Locks live in a weak-valued Caffeine cache: a lock stays in the cache while any thread holds or
 * waits on it, and is collected once no thread references it. Writes to different events never contend.
 */
@Component
public class EventLockManager {

    private static final Logger logger = LoggerFactory.getLogger(EventLockManager.class);

    private final Cache<String, ReentrantLock> locks;
    private final Duration lockTimeout;
    private final MeterRegistry meterRegistry;

    @Autowired
    public EventLockManager(EngineProperties properties, MeterRegistry meterRegistry) {
        this.lockTimeout = properties.getLockTimeout();
        this.meterRegistry = meterRegistry;
        this.locks = Caffeine.newBuilder()
                .weakValues()
                .build();
    }

    /**
     * Runs the action while holding the write lock of the event.
     *
     * @throws EventBusyException if the lock is not acquired within the configured timeout
     */
    public <T> T withEventLock(String eventId, Supplier<T> action) {
        ReentrantLock lock = locks.get(eventId, id -> new ReentrantLock(true));
        boolean acquired;
        try {
            acquired = lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EventBusyException("Interrupted while waiting for event " + eventId, e);
        }
        if (!acquired) {
            logger.warn("Timed out after {}ms waiting for write lock on event {}", lockTimeout.toMillis(), eventId);
            meterRegistry.counter("event.lock.timeout").increment();
            throw new EventBusyException("Event " + eventId + " is busy, please retry");
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}

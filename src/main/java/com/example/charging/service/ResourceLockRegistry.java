package com.example.charging.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per resource id. A resource's queue is the unit of mutual exclusion;
 * different resources never contend.
 */
@Slf4j
@Component
public class ResourceLockRegistry {

    private final Map<Long, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(Long resourceId, Supplier<T> body) {
        ReentrantLock lock = locks.computeIfAbsent(resourceId, id -> new ReentrantLock(true));
        lock.lock();
        try {
            return body.get();
        } finally {
            lock.unlock();
        }
    }

}

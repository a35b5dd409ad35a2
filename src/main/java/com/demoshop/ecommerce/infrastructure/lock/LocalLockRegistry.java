package com.demoshop.ecommerce.infrastructure.lock;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 키별 ReentrantLock 보관소
 *
 * 락 객체는 키당 하나만 만들어지고 재사용된다.
 * 사용자 수만큼만 늘어나므로 별도 정리는 하지 않는다.
 */
@Component
public class LocalLockRegistry {

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ReentrantLock getLock(String key) {
        return locks.computeIfAbsent(key, k -> new ReentrantLock(true));
    }

    int size() {
        return locks.size();
    }
}

package com.tradingstation.account;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * One reentrant lock per account id. Every mutation of an account's cash or positions
 * runs under that account's lock; different accounts never contend.
 *
 * <p>The locks are reentrant so the order coordinator can hold the lock across a whole
 * reserve-then-open sequence while the ledger and position book lock again inside it.
 */
@Component
public class AccountLockManager {

    private final Map<Long, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(Long accountId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(accountId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void runWithLock(Long accountId, Runnable action) {
        withLock(accountId, () -> {
            action.run();
            return null;
        });
    }
}

package com.tradegate.backend.trading.pipeline;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per portfolio, held across snapshot, risk decision and hand-off so two
 * approvals cannot both spend the same heat headroom.
 */
@Component
public class PortfolioLockRegistry {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String portfolioId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(portfolioId, ignored -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}

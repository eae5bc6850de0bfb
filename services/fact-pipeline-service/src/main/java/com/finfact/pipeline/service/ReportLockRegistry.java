package com.finfact.pipeline.service;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * One lock per report, shared by automatic and manual resolution. Automatic runs fail fast;
 * manual resolutions wait up to a bound. An entry lives only while some caller holds or waits for it.
 */
@Component
public class ReportLockRegistry {

    private final ConcurrentHashMap<String, ReportLock> locks = new ConcurrentHashMap<>();

    public <T> T runExclusive(String reportId, Supplier<T> action) {
        ReportLock entry = acquire(reportId);
        try {
            if (!entry.lock.tryLock()) {
                throw new ResolutionInProgressException(reportId);
            }
            try {
                return action.get();
            } finally {
                entry.lock.unlock();
            }
        } finally {
            release(reportId);
        }
    }

    public <T> T runWaiting(String reportId, Duration maxWait, Supplier<T> action) {
        ReportLock entry = acquire(reportId);
        try {
            try {
                if (!entry.lock.tryLock(maxWait.toMillis(), TimeUnit.MILLISECONDS)) {
                    throw new ResolutionInProgressException(reportId);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ResolutionInProgressException(reportId);
            }
            try {
                return action.get();
            } finally {
                entry.lock.unlock();
            }
        } finally {
            release(reportId);
        }
    }

    int trackedReports() {
        return locks.size();
    }

    // users is only touched inside compute, which runs atomically per key
    private ReportLock acquire(String reportId) {
        return locks.compute(reportId, (id, existing) -> {
            ReportLock entry = existing == null ? new ReportLock() : existing;
            entry.users++;
            return entry;
        });
    }

    private void release(String reportId) {
        locks.computeIfPresent(reportId, (id, entry) -> --entry.users == 0 ? null : entry);
    }

    private static final class ReportLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}

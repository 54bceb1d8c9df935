package com.dexrouter.backend.service.queue;

import java.util.ArrayDeque;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Admits at most {@code limit} jobs in any window of {@code windowNanos}. Callers over the limit wait until
 * the oldest admission in the window ages out.
 */
class AdmissionRateLimiter {

    private final int limit;
    private final long windowNanos;
    private final LongSupplier nanoClock;
    private final ArrayDeque<Long> admissions = new ArrayDeque<>();

    AdmissionRateLimiter(int limit, long windowMillis) {
        this(limit, windowMillis, System::nanoTime);
    }

    AdmissionRateLimiter(int limit, long windowMillis, LongSupplier nanoClock) {
        this.limit = limit;
        this.windowNanos = TimeUnit.MILLISECONDS.toNanos(windowMillis);
        this.nanoClock = nanoClock;
    }

    void acquire() throws InterruptedException {
        while (true) {
            long waitNanos = tryAcquire();
            if (waitNanos == 0) {
                return;
            }
            TimeUnit.NANOSECONDS.sleep(waitNanos);
        }
    }

    /**
     * @return 0 if admitted, otherwise how long to wait before asking again
     */
    synchronized long tryAcquire() {
        long now = nanoClock.getAsLong();
        while (!admissions.isEmpty() && now - admissions.peekFirst() >= windowNanos) {
            admissions.pollFirst();
        }
        if (admissions.size() < limit) {
            admissions.addLast(now);
            return 0;
        }
        return Math.max(1, windowNanos - (now - admissions.peekFirst()));
    }

    synchronized int admittedInWindow() {
        return admissions.size();
    }
}

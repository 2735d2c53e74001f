package com.complaintportal.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-key sliding-window log: at most {@code maxRequests} accepted requests per key in any
 * {@code window}. Rejected requests are not counted.
 */
public class SlidingWindowRateLimiter {

    private final int maxRequests;
    private final long windowMillis;
    private final Clock clock;

    private final ConcurrentMap<String, Deque<Long>> hits = new ConcurrentHashMap<>();
    private final AtomicLong lastSweep = new AtomicLong();

    public SlidingWindowRateLimiter(int maxRequests, Duration window, Clock clock) {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be positive");
        }
        this.maxRequests = maxRequests;
        this.windowMillis = window.toMillis();
        this.clock = clock;
        this.lastSweep.set(clock.millis());
    }

    /**
     * Records a request for {@code key} if it fits in the window.
     *
     * @return 0 when accepted, otherwise the milliseconds until a slot frees up
     */
    public long tryAcquire(String key) {
        long now = clock.millis();
        sweepIdle(now);

        long[] wait = {0};
        hits.compute(key, (k, log) -> {
            Deque<Long> q = (log != null) ? log : new ArrayDeque<>();
            evictExpired(q, now);
            if (q.size() >= maxRequests) {
                wait[0] = Math.max(1, q.peekFirst() + windowMillis - now);
            } else {
                q.addLast(now);
            }
            return q;
        });
        return wait[0];
    }

    int trackedKeys() {
        return hits.size();
    }

    private void evictExpired(Deque<Long> q, long now) {
        while (!q.isEmpty() && q.peekFirst() <= now - windowMillis) {
            q.pollFirst();
        }
    }

    // Drops keys with nothing left in the window, at most once per window
    private void sweepIdle(long now) {
        long last = lastSweep.get();
        if (now - last < windowMillis || !lastSweep.compareAndSet(last, now)) {
            return;
        }
        for (String key : hits.keySet()) {
            hits.computeIfPresent(key, (k, q) -> {
                evictExpired(q, now);
                return q.isEmpty() ? null : q;
            });
        }
    }
}

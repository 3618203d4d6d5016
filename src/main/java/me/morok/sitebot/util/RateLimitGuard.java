package me.morok.sitebot.util;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;

/**
 * Скользящее окно на каждого клиента по его адресу: не больше {@code maxRequests} принятых
 * запросов за {@code windowMs}.
 */
public class RateLimitGuard {

    static int CLEANUP_EVERY = 64;

    int maxRequests;
    long windowMs;

    LongSupplier clock;

    ConcurrentHashMap<String, Deque<Long>> hits = new ConcurrentHashMap<>();
    AtomicInteger calls = new AtomicInteger(0);

    public RateLimitGuard(int maxRequests, long windowMs) {
        this(maxRequests, windowMs, System::currentTimeMillis);
    }

    public RateLimitGuard(int maxRequests, long windowMs, LongSupplier clock) {
        this.maxRequests = Math.max(1, maxRequests);
        this.windowMs = Math.max(1, windowMs);
        this.clock = clock;
    }

    /**
     * @return false если лимит исчерпан; отклонённый запрос в окно не записывается
     */
    public boolean tryAcquire(String key) {
        if (key == null) key = "";

        long now = clock.getAsLong();
        boolean[] accepted = new boolean[1];

        // проверка и запись под блокировкой ключа, иначе cleanup может выкинуть очередь между ними
        hits.compute(key, (k, q) -> {
            if (q == null) q = new ArrayDeque<>();
            evict(q, now);
            accepted[0] = q.size() < maxRequests;
            if (accepted[0]) q.addLast(now);
            return q.isEmpty() ? null : q;
        });

        if (calls.incrementAndGet() % CLEANUP_EVERY == 0) cleanup(now);
        return accepted[0];
    }

    int trackedKeys() {
        return hits.size();
    }

    void evict(Deque<Long> q, long now) {
        while (!q.isEmpty() && now - q.peekFirst() >= windowMs) q.pollFirst();
    }

    void cleanup(long now) {
        for (String key : hits.keySet()) {
            hits.computeIfPresent(key, (k, q) -> {
                evict(q, now);
                return q.isEmpty() ? null : q;
            });
        }
    }
}

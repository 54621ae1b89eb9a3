package io.meshward.gossip;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Sliding one-second window of accepted message times per sender.
 *
 * <p>Not thread-safe; {@link SignedGossip} serializes access.
 */
final class SenderRateLimiter {
    static final long WINDOW_MS = 1_000L;

    private final int maxPerWindow;
    private final Map<String, Deque<Long>> acceptedAt = new HashMap<>();

    SenderRateLimiter(int maxPerWindow) {
        if (maxPerWindow < 1) {
            throw new IllegalArgumentException("Rate limit must be >= 1, got " + maxPerWindow);
        }
        this.maxPerWindow = maxPerWindow;
    }

    boolean exceeded(String sender, long nowMs) {
        Deque<Long> times = acceptedAt.get(sender);
        if (times == null) {
            return false;
        }
        long cutoff = nowMs - WINDOW_MS;
        while (!times.isEmpty() && times.peekFirst() <= cutoff) {
            times.pollFirst();
        }
        if (times.isEmpty()) {
            acceptedAt.remove(sender);
            return false;
        }
        return times.size() >= maxPerWindow;
    }

    void record(String sender, long nowMs) {
        acceptedAt.computeIfAbsent(sender, k -> new ArrayDeque<>()).addLast(nowMs);
    }

    /** Drops senders with no accepted message inside the window. */
    int prune(long nowMs) {
        long cutoff = nowMs - WINDOW_MS;
        int before = acceptedAt.size();
        acceptedAt.values().removeIf(times -> times.isEmpty() || times.peekLast() <= cutoff);
        return before - acceptedAt.size();
    }

    int trackedSenders() {
        return acceptedAt.size();
    }

    int maxPerWindow() {
        return maxPerWindow;
    }
}

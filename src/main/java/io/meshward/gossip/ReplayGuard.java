package io.meshward.gossip;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Anti-replay record: sender -> epoch -> nonces already accepted.
 *
 * <p>Not thread-safe; {@link SignedGossip} serializes access.
 */
final class ReplayGuard {
    private final Map<String, Map<Long, Set<Long>>> seen = new HashMap<>();

    boolean contains(String sender, long epoch, long nonce) {
        Map<Long, Set<Long>> byEpoch = seen.get(sender);
        if (byEpoch == null) {
            return false;
        }
        Set<Long> nonces = byEpoch.get(epoch);
        return nonces != null && nonces.contains(nonce);
    }

    boolean record(String sender, long epoch, long nonce) {
        return seen.computeIfAbsent(sender, k -> new HashMap<>())
                .computeIfAbsent(epoch, k -> new HashSet<>())
                .add(nonce);
    }

    /** Drops the nonces of every epoch older than {@code oldestEpoch}, for all senders. */
    void retainFrom(long oldestEpoch) {
        seen.values().removeIf(byEpoch -> {
            byEpoch.keySet().removeIf(e -> e < oldestEpoch);
            return byEpoch.isEmpty();
        });
    }

    int size() {
        int total = 0;
        for (Map<Long, Set<Long>> byEpoch : seen.values()) {
            for (Set<Long> nonces : byEpoch.values()) {
                total += nonces.size();
            }
        }
        return total;
    }
}

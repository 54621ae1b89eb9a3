package io.meshward.config;

import io.meshward.routing.AclPolicy;
import io.meshward.routing.AclProfile;
import io.meshward.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Effective node settings. Every value read from the settings file is
 * sanitized against the defaults: missing fields fall back, numbers are
 * clamped to their minimums and rates to their valid ranges.
 */
public record MeshSettings(
        String nodeId,
        int totalNodes,
        double quorumThreshold,
        long peerTimeoutMs,
        long healthCheckIntervalMs,
        double pheromoneDecayRate,
        double pheromoneBoost,
        double pheromoneMin,
        long decayIntervalMs,
        int rateLimitPerSecond,
        long quarantineMs,
        long keyRotationIntervalMs,
        long pendingEventTtlMs,
        boolean requireSignedBeacons,
        int bindPort,
        List<String> seeds,
        long gossipIntervalMs,
        long receiveWindowMs,
        List<String> localTags,
        AclProfile aclProfile,
        List<AclPolicy> aclPolicies,
        Map<String, List<String>> peerTags
) {
    public static final String DEFAULT_NODE_ID = "node-1";

    public MeshSettings {
        seeds = seeds == null ? List.of() : List.copyOf(seeds);
        localTags = localTags == null ? List.of() : List.copyOf(localTags);
        aclPolicies = aclPolicies == null ? List.of() : List.copyOf(aclPolicies);
        peerTags = peerTags == null ? Map.of() : Map.copyOf(peerTags);
    }

    public static MeshSettings defaults() {
        return new MeshSettings(
                DEFAULT_NODE_ID,
                10,
                0.67d,
                30_000L,
                5_000L,
                0.9d,
                10.0d,
                1.0d,
                1_000L,
                100,
                300_000L,
                0L,
                0L,
                false,
                0,
                List.of(),
                2_000L,
                500L,
                List.of(),
                AclProfile.DEFAULT,
                List.of(),
                Map.of()
        );
    }

    /** Reads the settings file under {@code config}; a missing file yields the defaults. */
    public static MeshSettings load(MeshWardConfig config) {
        Path file = config.settingsFile();
        if (!Files.isRegularFile(file)) {
            return defaults();
        }
        try {
            MeshSettingsFile raw = Jsons.mapper().readValue(file.toFile(), MeshSettingsFile.class);
            return fromFile(raw, defaults());
        } catch (IOException e) {
            throw new RuntimeException("Failed to read settings file: " + file, e);
        }
    }

    public static MeshSettings fromFile(MeshSettingsFile file, MeshSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long peerTimeout = sanitizeLong(file.peerTimeoutMs(), defaults.peerTimeoutMs(), 1L);
        double decayRate = file.pheromoneDecayRate() == null
                || file.pheromoneDecayRate() <= 0d
                || file.pheromoneDecayRate() >= 1d
                ? defaults.pheromoneDecayRate()
                : file.pheromoneDecayRate();
        double threshold = file.quorumThreshold() == null
                || file.quorumThreshold().isNaN()
                || file.quorumThreshold() <= 0d
                ? defaults.quorumThreshold()
                : Math.min(1d, file.quorumThreshold());
        int bindPort = sanitizeInt(file.bindPort(), defaults.bindPort(), 0);
        return new MeshSettings(
                sanitizeText(file.nodeId(), defaults.nodeId()),
                sanitizeInt(file.totalNodes(), defaults.totalNodes(), 1),
                threshold,
                peerTimeout,
                sanitizeLong(file.healthCheckIntervalMs(), defaults.healthCheckIntervalMs(), 10L),
                decayRate,
                sanitizeDouble(file.pheromoneBoost(), defaults.pheromoneBoost(), 0.001d),
                sanitizeDouble(file.pheromoneMin(), defaults.pheromoneMin(), 0.1d),
                sanitizeLong(file.decayIntervalMs(), defaults.decayIntervalMs(), 10L),
                sanitizeInt(file.rateLimitPerSecond(), defaults.rateLimitPerSecond(), 1),
                sanitizeLong(file.quarantineMs(), defaults.quarantineMs(), 1L),
                sanitizeLong(file.keyRotationIntervalMs(), defaults.keyRotationIntervalMs(), 0L),
                sanitizeLong(file.pendingEventTtlMs(), defaults.pendingEventTtlMs(), 0L),
                file.requireSignedBeacons() == null ? defaults.requireSignedBeacons() : file.requireSignedBeacons(),
                bindPort > 65535 ? defaults.bindPort() : bindPort,
                sanitizeList(file.seeds(), defaults.seeds()),
                sanitizeLong(file.gossipIntervalMs(), defaults.gossipIntervalMs(), 10L),
                sanitizeLong(file.receiveWindowMs(), defaults.receiveWindowMs(), 100L),
                sanitizeList(file.localTags(), defaults.localTags()),
                file.aclProfile() == null ? defaults.aclProfile() : AclProfile.fromString(file.aclProfile()),
                file.aclPolicies() == null ? defaults.aclPolicies() : file.aclPolicies(),
                file.peerTags() == null ? defaults.peerTags() : sanitizeTags(file.peerTags())
        );
    }

    /** Writes these settings in the file shape, replacing any existing file. */
    public void write(Path file) {
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            Files.writeString(file, Jsons.toJson(toFile()) + System.lineSeparator());
        } catch (IOException e) {
            throw new RuntimeException("Failed to write settings file: " + file, e);
        }
    }

    public MeshSettingsFile toFile() {
        return new MeshSettingsFile(
                nodeId,
                totalNodes,
                quorumThreshold,
                peerTimeoutMs,
                healthCheckIntervalMs,
                pheromoneDecayRate,
                pheromoneBoost,
                pheromoneMin,
                decayIntervalMs,
                rateLimitPerSecond,
                quarantineMs,
                keyRotationIntervalMs,
                pendingEventTtlMs,
                requireSignedBeacons,
                bindPort,
                seeds,
                gossipIntervalMs,
                receiveWindowMs,
                localTags,
                aclProfile.wireName(),
                aclPolicies,
                peerTags
        );
    }

    public MeshSettings withNodeId(String newNodeId) {
        return new MeshSettings(
                sanitizeText(newNodeId, nodeId),
                totalNodes,
                quorumThreshold,
                peerTimeoutMs,
                healthCheckIntervalMs,
                pheromoneDecayRate,
                pheromoneBoost,
                pheromoneMin,
                decayIntervalMs,
                rateLimitPerSecond,
                quarantineMs,
                keyRotationIntervalMs,
                pendingEventTtlMs,
                requireSignedBeacons,
                bindPort,
                seeds,
                gossipIntervalMs,
                receiveWindowMs,
                localTags,
                aclProfile,
                aclPolicies,
                peerTags
        );
    }

    public Duration peerTimeout() {
        return Duration.ofMillis(peerTimeoutMs);
    }

    public Duration quarantine() {
        return Duration.ofMillis(quarantineMs);
    }

    public Duration pendingEventTtl() {
        return Duration.ofMillis(pendingEventTtlMs);
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static double sanitizeDouble(Double raw, double fallback, double min) {
        if (raw == null || raw.isNaN() || raw.isInfinite()) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static String sanitizeText(String raw, String fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return raw.trim();
    }

    private static List<String> sanitizeList(List<String> raw, List<String> fallback) {
        if (raw == null) {
            return fallback;
        }
        List<String> out = new ArrayList<>();
        for (String value : raw) {
            if (value != null && !value.isBlank()) {
                out.add(value.trim());
            }
        }
        return out;
    }

    private static Map<String, List<String>> sanitizeTags(Map<String, List<String>> raw) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : raw.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                continue;
            }
            out.put(entry.getKey().trim(), sanitizeList(entry.getValue(), List.of()));
        }
        return out;
    }
}

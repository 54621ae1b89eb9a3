package io.meshward.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.meshward.util.Hashing;
import io.meshward.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Append-only JSON-lines log of node activity.
 *
 * <p>Every row carries the SHA-256 of its own content and the hash of the row
 * before it, so truncation or edits break the chain. The chain head is reloaded
 * from the file on construction.
 *
 * <p>{@link #log} throws when the row cannot be written. Background loops and
 * protocol handlers use {@link #tryLog} instead, which reports the failure on
 * stderr and counts it.
 */
public final class AuditLogger {
    private final Path auditFile;
    private final String nodeId;
    private final Clock clock;
    private final AtomicLong failedWrites = new AtomicLong();
    private String previousHash;

    public AuditLogger(Path auditFile, String nodeId) {
        this(auditFile, nodeId, Clock.systemUTC());
    }

    public AuditLogger(Path auditFile, String nodeId, Clock clock) {
        this.auditFile = auditFile;
        this.nodeId = nodeId == null || nodeId.isBlank() ? "unknown" : nodeId.trim();
        this.clock = clock;
        try {
            if (auditFile.getParent() != null) {
                Files.createDirectories(auditFile.getParent());
            }
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", clock.instant().toString());
        row.put("node_id", nodeId);
        row.put("action", event.action());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    /**
     * Writes the row like {@link #log}, but a write failure is counted and
     * printed as a warning instead of thrown.
     *
     * @return {@code false} when the row was not written
     */
    public boolean tryLog(AuditEvent event) {
        try {
            log(event);
            return true;
        } catch (RuntimeException e) {
            failedWrites.incrementAndGet();
            System.err.println("WARN audit write failed for " + event.action() + ": " + e.getMessage());
            return false;
        }
    }

    public long failedWrites() {
        return failedWrites.get();
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public Path auditFile() {
        return auditFile;
    }

    /**
     * Recomputes the chain from the first row.
     *
     * @return number of rows checked, or -1 when a row does not match its hash or predecessor
     */
    public synchronized int verifyChain() {
        List<String> lines;
        try {
            lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
        String expectedPrev = "";
        int rows = 0;
        for (String line : lines) {
            if (line == null || line.isBlank()) {
                continue;
            }
            try {
                @SuppressWarnings("unchecked")
                Map<String, Object> row = Jsons.compact().readValue(line, LinkedHashMap.class);
                Object hash = row.remove("hash");
                if (!expectedPrev.equals(row.get("prev_hash"))) {
                    return -1;
                }
                String recomputed = Hashing.sha256Hex(Jsons.toCompactJson(row));
                if (!recomputed.equals(hash)) {
                    return -1;
                }
                expectedPrev = recomputed;
                rows++;
            } catch (IOException e) {
                return -1;
            }
        }
        return rows;
    }

    private String loadLastHash() {
        try {
            if (!Files.exists(auditFile)) {
                return "";
            }
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            JsonNode node = Jsons.mapper().readTree(last);
            return node.path("hash").asText("");
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log head: " + auditFile, e);
        }
    }

    public record AuditEvent(String action, String resource, String result, Map<String, Object> details) {
        public static AuditEvent of(String action, String resource, String result, Map<String, Object> details) {
            return new AuditEvent(action, resource, result, details == null ? Map.of() : details);
        }
    }
}

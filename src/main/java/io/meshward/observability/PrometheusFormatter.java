package io.meshward.observability;

import io.meshward.protection.ProtectionStats;
import io.meshward.runtime.MeshStatus;

import java.util.Map;
import java.util.TreeMap;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(MeshStatus status) {
        StringBuilder sb = new StringBuilder();
        ProtectionStats protection = status.protection();
        appendGauge(sb, "meshward_node_running", "Whether the node loops are running (1=yes,0=no)", null, null, status.running() ? 1 : 0);
        appendGauge(sb, "meshward_peers_total", "Peers grouped by liveness state", "state", "alive", status.activePeers());
        appendGauge(sb, "meshward_peers_total", "Peers grouped by liveness state", "state", "locally_dead", status.locallyDeadPeers().size());
        appendGauge(sb, "meshward_peers_total", "Peers grouped by liveness state", "state", "validated_failed", status.validatedFailures().size());
        appendGauge(sb, "meshward_beacons_total", "Beacons grouped by ingestion result", "result", "accepted", status.beaconsReceived());
        appendGauge(sb, "meshward_beacons_total", "Beacons grouped by ingestion result", "result", "rejected", status.beaconsRejected());
        appendGauge(sb, "meshward_failure_votes_received_total", "Failure votes accepted from peers", null, null, status.votesReceived());
        appendGauge(sb, "meshward_route_pairs", "Tracked (destination, next hop) pheromone pairs", null, null, status.trackedRoutes());
        appendGauge(sb, "meshward_acl_policies", "Configured ACL policies", null, null, status.aclPolicies());
        appendGauge(sb, "meshward_malformed_datagrams_total", "Datagrams dropped because they did not decode", null, null, status.malformedDatagrams());
        appendGauge(sb, "meshward_loop_errors_total", "Periodic loop ticks that failed", null, null, status.loopErrors());
        appendGauge(sb, "meshward_gossip_epoch", "Current signing key epoch", null, null, protection.currentEpoch());
        appendGauge(sb, "meshward_gossip_tracked_nonces", "Nonces held by the anti-replay record", null, null, protection.trackedNonces());
        appendGauge(sb, "meshward_quarantined_nodes", "Nodes currently quarantined", null, null, protection.quarantinedNodes().size());
        appendGauge(sb, "meshward_quorum_size", "Distinct validator signatures required for a critical event", null, null, protection.quorumSize());
        appendGauge(sb, "meshward_quorum_events", "Critical events grouped by state", "state", "pending", protection.pendingEvents());
        appendGauge(sb, "meshward_quorum_events", "Critical events grouped by state", "state", "validated", protection.validatedEvents());
        appendRatioGauge(sb, "meshward_node_reputation", "Reputation score per sender below full trust", "node", new TreeMap<>(protection.reputations()));
        return sb.toString();
    }

    private static void appendRatioGauge(StringBuilder sb, String metric, String help, String label, Map<String, Double> values) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        for (Map.Entry<String, Double> e : values.entrySet()) {
            sb.append(metric).append('{')
                    .append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                    .append(' ').append(e.getValue()).append('\n');
        }
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        if (!sb.toString().contains("# HELP " + metric + " ")) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        }
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}

package io.meshward.model;

import java.util.Map;

public record PacketLossEvidence(double ratio) implements Evidence {
    public PacketLossEvidence {
        if (Double.isNaN(ratio) || ratio < 0d || ratio > 1d) {
            throw new IllegalArgumentException("Packet loss ratio must be in [0,1]: " + ratio);
        }
    }

    @Override
    public String kind() {
        return "packet_loss";
    }

    @Override
    public Map<String, Object> attributes() {
        return Map.of("packet_loss", ratio);
    }
}

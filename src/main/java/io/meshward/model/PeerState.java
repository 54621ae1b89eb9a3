package io.meshward.model;

/**
 * Liveness of a peer as seen by the local node.
 *
 * <p>{@code LOCALLY_DEAD} returns to {@code ALIVE} on a fresh beacon;
 * {@code VALIDATED_FAILED} is terminal.
 */
public enum PeerState {
    ALIVE,
    LOCALLY_DEAD,
    VALIDATED_FAILED
}

package io.meshward.model;

public enum MessageType {
    BEACON,
    FAILURE_VOTE
}

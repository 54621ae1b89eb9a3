package io.meshward.model;

public enum CriticalEventType {
    NODE_FAILURE,
    LINK_DOWN
}

package com.openisp.ha.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Status of a roster member as seen by the cluster.
 */
public enum NodeStatus {

    /**
     * Node is reachable and in sync.
     */
    ONLINE("online"),

    /**
     * Node is reachable and catching up on replication.
     */
    SYNCING("syncing"),

    /**
     * Node missed heartbeats or was replaced by a failover.
     */
    OFFLINE("offline"),

    /**
     * Node reported a replication or health error.
     */
    ERROR("error");

    private final String value;

    NodeStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static NodeStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown node status: " + value));
    }
}

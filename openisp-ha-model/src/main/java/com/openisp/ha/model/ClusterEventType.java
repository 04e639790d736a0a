package com.openisp.ha.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Audit event types written to the cluster event log.
 */
public enum ClusterEventType {

    FAILOVER_STARTED("failover_started"),
    FAILOVER_COMPLETED("failover_completed"),
    FAILOVER_FAILED("failover_failed"),
    MANUAL_FAILOVER("manual_failover"),
    PROMOTION_RECEIVED("promotion_received"),
    SWITCHOVER_STARTED("switchover_started"),
    SWITCHOVER_COMPLETED("switchover_completed"),
    SWITCHOVER_FAILED("switchover_failed"),
    NEW_MAIN_ACKNOWLEDGED("new_main_acknowledged"),
    CLUSTER_CREATED("cluster_created"),
    NODE_JOINED("node_joined"),
    NODE_REJOINED("node_rejoined"),
    NODE_REMOVED("node_removed"),
    NODE_LEFT("node_left");

    private final String value;

    ClusterEventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}

package com.openisp.ha.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Role a server plays in the cluster.
 *
 * <ul>
 *   <li>STANDALONE - not part of any cluster (initial and terminal state)</li>
 *   <li>MAIN - the single writable primary</li>
 *   <li>SECONDARY - replica eligible for automatic failover</li>
 *   <li>SERVER3 - read-only reporting replica, never promoted</li>
 * </ul>
 */
public enum ServerRole {

    STANDALONE("standalone"),
    MAIN("main"),
    SECONDARY("secondary"),
    SERVER3("server3");

    private final String value;

    ServerRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Checks if a node holding this role can be promoted by a failover.
     */
    public boolean isPromotable() {
        return this == SECONDARY;
    }

    @JsonCreator
    public static ServerRole fromValue(String value) {
        return Arrays.stream(values())
                .filter(role -> role.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown server role: " + value));
    }
}

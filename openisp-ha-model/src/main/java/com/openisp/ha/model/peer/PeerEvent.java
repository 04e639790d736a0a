package com.openisp.ha.model.peer;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Event names carried in the {@code event} field of peer control messages.
 */
public enum PeerEvent {

    /**
     * Broadcast by a freshly promoted node to every other member.
     */
    NEW_MAIN("new_main"),

    /**
     * Manual failover request sent by the current main to a secondary.
     */
    PROMOTE_TO_MAIN("promote_to_main"),

    /**
     * Planned switchover request sent by a fenced main to a secondary.
     */
    SWITCHOVER("switchover"),

    /**
     * Configuration refresh hint; acknowledged without action.
     */
    CONFIG_UPDATE("config_update"),

    UNKNOWN("unknown");

    private final String value;

    PeerEvent(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static PeerEvent fromValue(String value) {
        return Arrays.stream(values())
                .filter(event -> event.value.equalsIgnoreCase(value))
                .findFirst()
                .orElse(UNKNOWN);
    }
}

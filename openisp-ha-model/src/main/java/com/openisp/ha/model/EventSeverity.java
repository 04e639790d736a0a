package com.openisp.ha.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity attached to a cluster audit event.
 */
public enum EventSeverity {

    INFO("info"),
    WARNING("warning"),
    CRITICAL("critical");

    private final String value;

    EventSeverity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}

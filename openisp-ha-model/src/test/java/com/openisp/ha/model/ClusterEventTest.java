package com.openisp.ha.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ClusterEventTest {

    private static final Instant AT = Instant.parse("2024-05-01T10:00:00Z");

    private static ClusterConfig main() {
        return ClusterConfig.builder()
                .clusterId("cluster-1")
                .hardwareId("hw-1")
                .serverIp("10.0.0.1")
                .serverRole(ServerRole.MAIN)
                .build();
    }

    @Test
    @DisplayName("should stamp a local event with the given time and this node's address")
    void shouldStampLocalEvent() {
        ClusterEvent event = ClusterEvent.local(main(), ClusterEventType.FAILOVER_STARTED,
                EventSeverity.CRITICAL, "started", AT);

        assertEquals(AT, event.getCreatedAt());
        assertEquals("cluster-1", event.getClusterId());
        assertEquals("10.0.0.1", event.getNodeIp());
        assertEquals(ServerRole.MAIN, event.getNodeRole());
    }

    @Test
    @DisplayName("should attribute a roster event to the member")
    void shouldStampNodeEvent() {
        ClusterNode node = ClusterNode.builder()
                .id(7L)
                .clusterId("cluster-1")
                .hardwareId("hw-3")
                .serverIp("10.0.0.3")
                .serverRole(ServerRole.SERVER3)
                .build();

        ClusterEvent event = ClusterEvent.aboutNode("cluster-1", node, ClusterEventType.NODE_REMOVED,
                EventSeverity.WARNING, "removed", AT);

        assertEquals(AT, event.getCreatedAt());
        assertEquals(7L, event.getNodeId());
        assertEquals("10.0.0.3", event.getNodeIp());
    }

    @Test
    @DisplayName("should refuse an event without a timestamp")
    void shouldRequireTimestamp() {
        NullPointerException error = assertThrows(NullPointerException.class, () -> ClusterEvent.builder()
                .eventType(ClusterEventType.NODE_LEFT)
                .build());

        assertEquals("createdAt must not be null", error.getMessage());
    }

    @Test
    @DisplayName("should keep the timestamp when an id is assigned")
    void shouldKeepTimestampOnId() {
        ClusterEvent event = ClusterEvent.local(main(), ClusterEventType.NODE_LEFT, EventSeverity.WARNING, "left", AT);

        assertEquals(AT, event.withId(3L).getCreatedAt());
    }
}

package com.openisp.ha.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Objects;

/**
 * Append-only audit record of a cluster transition.
 *
 * For automatic failover this log is the only trace an operator has after the
 * fact, so every fatal pipeline error ends up here.
 */
@Getter
@ToString
public final class ClusterEvent {

    private final long id;
    private final String clusterId;
    private final ClusterEventType eventType;
    private final long nodeId;
    private final String nodeIp;
    private final ServerRole nodeRole;
    private final String description;
    private final EventSeverity severity;
    private final Instant createdAt;

    @Builder(toBuilder = true)
    private ClusterEvent(long id,
                         String clusterId,
                         ClusterEventType eventType,
                         long nodeId,
                         String nodeIp,
                         ServerRole nodeRole,
                         String description,
                         EventSeverity severity,
                         Instant createdAt) {
        this.id = id;
        this.clusterId = clusterId;
        this.eventType = Objects.requireNonNull(eventType, "eventType must not be null");
        this.nodeId = nodeId;
        this.nodeIp = nodeIp;
        this.nodeRole = nodeRole;
        this.description = description;
        this.severity = severity != null ? severity : EventSeverity.INFO;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
    }

    /**
     * Creates an event describing something this node did, attributed to its own address and role.
     * The timestamp is taken from the caller's clock.
     */
    public static ClusterEvent local(ClusterConfig config, ClusterEventType type,
                                     EventSeverity severity, String description, Instant at) {
        return ClusterEvent.builder()
                .clusterId(config.getClusterId())
                .eventType(type)
                .nodeIp(config.getServerIp())
                .nodeRole(config.getServerRole())
                .severity(severity)
                .description(description)
                .createdAt(at)
                .build();
    }

    /**
     * Creates an event about a roster member.
     */
    public static ClusterEvent aboutNode(String clusterId, ClusterNode node, ClusterEventType type,
                                         EventSeverity severity, String description, Instant at) {
        return ClusterEvent.builder()
                .clusterId(clusterId)
                .eventType(type)
                .nodeId(node.getId())
                .nodeIp(node.getServerIp())
                .nodeRole(node.getServerRole())
                .severity(severity)
                .description(description)
                .createdAt(at)
                .build();
    }

    public ClusterEvent withId(long newId) {
        return toBuilder().id(newId).build();
    }
}

package com.openisp.ha.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Objects;

/**
 * Roster entry for one cluster member.
 *
 * Rows are logically owned by the current main, but every node may read them.
 */
@Getter
@ToString
public final class ClusterNode {

    private final long id;
    private final String clusterId;
    private final String hardwareId;
    private final String serverName;
    private final String serverIp;
    private final ServerRole serverRole;
    private final NodeStatus status;
    private final Instant lastHeartbeat;
    private final Instant joinedAt;

    @Builder(toBuilder = true)
    private ClusterNode(long id,
                        String clusterId,
                        String hardwareId,
                        String serverName,
                        String serverIp,
                        ServerRole serverRole,
                        NodeStatus status,
                        Instant lastHeartbeat,
                        Instant joinedAt) {
        this.id = id;
        this.clusterId = clusterId;
        this.hardwareId = Objects.requireNonNull(hardwareId, "hardwareId must not be null");
        this.serverName = serverName;
        this.serverIp = Objects.requireNonNull(serverIp, "serverIp must not be null");
        this.serverRole = Objects.requireNonNull(serverRole, "serverRole must not be null");
        this.status = status != null ? status : NodeStatus.OFFLINE;
        this.lastHeartbeat = lastHeartbeat;
        this.joinedAt = joinedAt;
    }

    public boolean isOnline() {
        return status == NodeStatus.ONLINE;
    }

    public boolean isMain() {
        return serverRole == ServerRole.MAIN;
    }

    public String getDisplayName() {
        return serverName != null && !serverName.isBlank() ? serverName : serverIp;
    }

    public ClusterNode withStatus(NodeStatus newStatus) {
        return toBuilder().status(newStatus).build();
    }

    public ClusterNode withRoleAndStatus(ServerRole newRole, NodeStatus newStatus) {
        return toBuilder().serverRole(newRole).status(newStatus).build();
    }

    public ClusterNode withId(long newId) {
        return toBuilder().id(newId).build();
    }
}

package com.openisp.ha.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Objects;

/**
 * Local view of this server's cluster membership.
 *
 * One instance exists per node. It is owned exclusively by the local controller
 * and replaced (never mutated in place) on every role transition. Only one node
 * in a cluster is expected to hold {@link ServerRole#MAIN} at a time; nothing
 * here enforces that across nodes.
 */
@Getter
@ToString(exclude = "clusterSecret")
public final class ClusterConfig {

    public static final int DEFAULT_MAIN_SERVER_PORT = 8080;

    private final String clusterId;
    @JsonIgnore
    private final String clusterSecret;
    private final String hardwareId;
    private final String serverName;
    private final String serverIp;
    private final ServerRole serverRole;
    private final ApiRole apiRole;
    private final RadiusRole radiusRole;
    private final String mainServerIp;
    private final int mainServerPort;
    private final boolean autoFailoverEnabled;
    private final Instant lastHeartbeat;

    @Builder(toBuilder = true)
    private ClusterConfig(String clusterId,
                          String clusterSecret,
                          String hardwareId,
                          String serverName,
                          String serverIp,
                          ServerRole serverRole,
                          ApiRole apiRole,
                          RadiusRole radiusRole,
                          String mainServerIp,
                          Integer mainServerPort,
                          boolean autoFailoverEnabled,
                          Instant lastHeartbeat) {
        this.clusterId = clusterId;
        this.clusterSecret = clusterSecret;
        this.hardwareId = Objects.requireNonNull(hardwareId, "hardwareId must not be null");
        this.serverName = serverName;
        this.serverIp = Objects.requireNonNull(serverIp, "serverIp must not be null");
        this.serverRole = serverRole != null ? serverRole : ServerRole.STANDALONE;
        this.apiRole = apiRole != null ? apiRole : ApiRole.ACTIVE;
        this.radiusRole = radiusRole != null ? radiusRole : RadiusRole.PRIMARY;
        this.mainServerIp = mainServerIp;
        this.mainServerPort = mainServerPort != null ? mainServerPort : DEFAULT_MAIN_SERVER_PORT;
        this.autoFailoverEnabled = autoFailoverEnabled;
        this.lastHeartbeat = lastHeartbeat;
    }

    public boolean isMain() {
        return serverRole == ServerRole.MAIN;
    }

    public boolean isSecondary() {
        return serverRole == ServerRole.SECONDARY;
    }

    /**
     * Checks if this node currently belongs to a cluster.
     */
    public boolean isClustered() {
        return serverRole != ServerRole.STANDALONE && clusterId != null && !clusterId.isBlank();
    }

    /**
     * Returns the config this node holds after being promoted to main.
     */
    public ClusterConfig promotedToMain(Instant now) {
        return toBuilder()
                .serverRole(ServerRole.MAIN)
                .apiRole(ApiRole.ACTIVE)
                .radiusRole(RadiusRole.PRIMARY)
                .mainServerIp(serverIp)
                .lastHeartbeat(now)
                .build();
    }

    /**
     * Returns the config this node holds after handing the main role to {@code newMainIp}.
     */
    public ClusterConfig demotedToSecondary(String newMainIp) {
        return toBuilder()
                .serverRole(ServerRole.SECONDARY)
                .apiRole(ApiRole.STANDBY)
                .radiusRole(RadiusRole.BACKUP)
                .mainServerIp(newMainIp)
                .build();
    }

    public ClusterConfig withMainServerIp(String newMainIp) {
        return toBuilder().mainServerIp(newMainIp).build();
    }

    public ClusterConfig withServerRole(ServerRole role) {
        return toBuilder().serverRole(role).build();
    }

    /**
     * Returns the config this node holds after leaving its cluster.
     */
    public ClusterConfig asStandalone() {
        return toBuilder()
                .serverRole(ServerRole.STANDALONE)
                .apiRole(ApiRole.ACTIVE)
                .radiusRole(RadiusRole.PRIMARY)
                .clusterId(null)
                .clusterSecret(null)
                .mainServerIp(null)
                .build();
    }
}

package com.openisp.ha.controller.membership;

import com.openisp.ha.controller.config.FailoverSettings;
import com.openisp.ha.controller.exception.ClusterConfigurationException;
import com.openisp.ha.controller.failover.FailoverMonitor;
import com.openisp.ha.controller.peer.IPeerNotifier;
import com.openisp.ha.controller.peer.PeerAuthenticator;
import com.openisp.ha.controller.replication.IReplicationDriver;
import com.openisp.ha.controller.replication.ReplicationSlots;
import com.openisp.ha.controller.store.IClusterConfigStore;
import com.openisp.ha.controller.store.IClusterEventLog;
import com.openisp.ha.controller.store.IClusterNodeRepository;
import com.openisp.ha.model.ApiRole;
import com.openisp.ha.model.ClusterConfig;
import com.openisp.ha.model.ClusterEvent;
import com.openisp.ha.model.ClusterEventType;
import com.openisp.ha.model.ClusterNode;
import com.openisp.ha.model.ClusterStatusView;
import com.openisp.ha.model.EventSeverity;
import com.openisp.ha.model.NodeStatus;
import com.openisp.ha.model.RadiusRole;
import com.openisp.ha.model.ServerRole;
import com.openisp.ha.model.peer.JoinRequest;
import com.openisp.ha.model.peer.JoinResponse;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Roster and membership operations backing the administrator surface.
 *
 * <ul>
 *   <li>setup-main turns a standalone server into the main of a new cluster</li>
 *   <li>setup-secondary asks an existing main to admit this server, then follows it</li>
 *   <li>join is the main's side of setup-secondary</li>
 *   <li>remove and leave shrink the roster again</li>
 * </ul>
 */
@Slf4j
public class ClusterMembershipService {

    public static final int RECENT_EVENT_LIMIT = 10;

    static final String CLUSTER_ID_PREFIX = "CL-";
    static final String DEFAULT_MAIN_NAME = "Main Server";
    static final String DEFAULT_SECONDARY_NAME = "Secondary Server";
    private static final int CLUSTER_ID_BYTES = 8;
    private static final int SECRET_BYTES = 16;

    private final IClusterConfigStore configStore;
    private final IClusterNodeRepository nodeRepository;
    private final IClusterEventLog eventLog;
    private final IReplicationDriver replicationDriver;
    private final IPeerNotifier peerNotifier;
    private final FailoverMonitor failoverMonitor;
    private final LocalNodeIdentity identity;
    private final FailoverSettings settings;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public ClusterMembershipService(IClusterConfigStore configStore,
                                    IClusterNodeRepository nodeRepository,
                                    IClusterEventLog eventLog,
                                    IReplicationDriver replicationDriver,
                                    IPeerNotifier peerNotifier,
                                    FailoverMonitor failoverMonitor,
                                    LocalNodeIdentity identity,
                                    FailoverSettings settings,
                                    Clock clock) {
        this.configStore = Objects.requireNonNull(configStore);
        this.nodeRepository = Objects.requireNonNull(nodeRepository);
        this.eventLog = Objects.requireNonNull(eventLog);
        this.replicationDriver = Objects.requireNonNull(replicationDriver);
        this.peerNotifier = Objects.requireNonNull(peerNotifier);
        this.failoverMonitor = Objects.requireNonNull(failoverMonitor);
        this.identity = Objects.requireNonNull(identity);
        this.settings = Objects.requireNonNull(settings);
        this.clock = Objects.requireNonNull(clock);
    }

    // ========== Cluster creation ==========

    /**
     * Creates a new cluster with this server as its main.
     *
     * @param serverName display name, defaults to "Main Server"
     * @param serverIp address peers reach this server on, defaults to the detected one
     * @return Mono with the new cluster's id and secret; signals {@link ClusterConfigurationException}
     *         if this server already belongs to a cluster
     */
    public Mono<ClusterSetupResult> setupMain(String serverName, String serverIp) {
        return configStore.load()
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(existing -> {
                    if (existing.isPresent() && existing.get().isClustered()) {
                        return Mono.error(alreadyClustered(existing.get()));
                    }
                    LocalNodeIdentity self = localIdentity(existing, serverName, serverIp, DEFAULT_MAIN_NAME);
                    Instant now = clock.instant();
                    ClusterConfig config = ClusterConfig.builder()
                            .clusterId(newClusterId())
                            .clusterSecret(newClusterSecret())
                            .hardwareId(self.getHardwareId())
                            .serverName(self.getServerName())
                            .serverIp(self.getServerIp())
                            .serverRole(ServerRole.MAIN)
                            .apiRole(ApiRole.ACTIVE)
                            .radiusRole(RadiusRole.PRIMARY)
                            .mainServerIp(self.getServerIp())
                            .mainServerPort(settings.getPeerPort())
                            .autoFailoverEnabled(true)
                            .lastHeartbeat(now)
                            .build();
                    log.info("Creating cluster {} with main {} ({})",
                            config.getClusterId(), self.getServerName(), self.getServerIp());

                    return configStore.save(config)
                            .flatMap(saved -> register(saved.getClusterId(), self, ServerRole.MAIN, now)
                                    .then(eventLog.append(ClusterEvent.local(saved, ClusterEventType.CLUSTER_CREATED,
                                            EventSeverity.INFO, "HA cluster created, main server configured", now)))
                                    .thenReturn(ClusterSetupResult.builder()
                                            .clusterId(saved.getClusterId())
                                            .clusterSecret(saved.getClusterSecret())
                                            .serverIp(saved.getServerIp())
                                            .build()));
                });
    }

    /**
     * Admits a server into this node's cluster. Runs on the main.
     *
     * A server already on the roster, matched by hardware id, is updated in place.
     *
     * @return Mono with what the joining server needs to follow this main; signals
     *         {@link ClusterConfigurationException} if this node is not main or the request is incomplete and
     *         {@link com.openisp.ha.controller.exception.ClusterAuthenticationException} on a bad secret
     */
    public Mono<JoinResponse> acceptJoin(JoinRequest request) {
        return configStore.load()
                .switchIfEmpty(Mono.error(() -> new ClusterConfigurationException("this server is not configured as main")))
                .flatMap(config -> {
                    if (!config.isMain()) {
                        return Mono.error(new ClusterConfigurationException("this server is not the main server"));
                    }
                    PeerAuthenticator.verify(config, request.getClusterSecret());
                    if (isBlank(request.getHardwareId()) || isBlank(request.getServerIp())) {
                        return Mono.error(new ClusterConfigurationException("hardware_id and server_ip are required"));
                    }
                    ServerRole role = joinableRole(request.getRequestedRole());
                    String slot = ReplicationSlots.forHardwareId(request.getHardwareId());
                    return nodeRepository.findByHardwareId(request.getHardwareId())
                            .flatMap(found -> found.isPresent()
                                    ? rejoin(config, found.get(), request, role)
                                    : firstJoin(config, request, role))
                            .then(reserveSlot(slot))
                            .thenReturn(JoinResponse.builder()
                                    .clusterId(config.getClusterId())
                                    .assignedRole(role)
                                    .mainServerIp(config.getServerIp())
                                    .replicationSlot(slot)
                                    .build());
                });
    }

    /**
     * Joins the cluster whose main is at {@code mainServerIp} and starts following it.
     *
     * The main is asked first; nothing is saved locally unless it admits this server.
     * Pointing the data store and cache at the main and starting the failover monitor
     * are best effort and only logged on failure.
     *
     * @param role {@link ServerRole#SECONDARY} (default) or {@link ServerRole#SERVER3}
     * @return Mono with the saved local config
     */
    public Mono<ClusterConfig> setupSecondary(String mainServerIp, String clusterSecret,
                                              String serverName, String serverIp, ServerRole role) {
        if (isBlank(mainServerIp) || isBlank(clusterSecret)) {
            return Mono.error(new ClusterConfigurationException("main_server_ip and cluster_secret are required"));
        }
        ServerRole requested;
        try {
            requested = joinableRole(role);
        } catch (ClusterConfigurationException e) {
            return Mono.error(e);
        }
        return configStore.load()
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(existing -> {
                    if (existing.isPresent() && existing.get().isClustered()) {
                        return Mono.error(alreadyClustered(existing.get()));
                    }
                    LocalNodeIdentity self = localIdentity(existing, serverName, serverIp, DEFAULT_SECONDARY_NAME);
                    JoinRequest join = JoinRequest.builder()
                            .clusterSecret(clusterSecret)
                            .hardwareId(self.getHardwareId())
                            .serverName(self.getServerName())
                            .serverIp(self.getServerIp())
                            .requestedRole(requested)
                            .build();
                    log.info("Asking main {} to admit {} ({}) as {}",
                            mainServerIp, self.getServerName(), self.getServerIp(), requested.getValue());

                    return peerNotifier.requestJoin(mainServerIp, join)
                            .flatMap(answer -> configStore.save(joinedConfig(self, clusterSecret, answer)))
                            .flatMap(saved -> followMain(saved).thenReturn(saved));
                });
    }

    // ========== Status and removal ==========

    /**
     * Builds the status snapshot: local role, roster, and the ten most recent events.
     * An unconfigured node reports itself standalone.
     */
    public Mono<ClusterStatusView> status() {
        return configStore.load()
                .filter(ClusterConfig::isClustered)
                .flatMap(config -> Mono.zip(
                                nodeRepository.findByClusterId(config.getClusterId()).collectList(),
                                eventLog.findRecent(config.getClusterId(), RECENT_EVENT_LIMIT).collectList())
                        .map(tuple -> toView(config, tuple.getT1(), tuple.getT2())))
                .defaultIfEmpty(ClusterStatusView.standalone());
    }

    /**
     * Removes a roster member. Only the main may do this, and never for the main's own row.
     */
    public Mono<ClusterNode> removeNode(long nodeId) {
        return configStore.load()
                .filter(ClusterConfig::isMain)
                .switchIfEmpty(Mono.error(() -> new ClusterConfigurationException("only main server can remove nodes")))
                .flatMap(config -> nodeRepository.findById(nodeId)
                        .flatMap(found -> {
                            if (found.isEmpty()) {
                                return Mono.error(new ClusterConfigurationException("node not found"));
                            }
                            ClusterNode node = found.get();
                            if (node.isMain()) {
                                return Mono.error(new ClusterConfigurationException("cannot remove main server"));
                            }
                            log.warn("Removing node {} ({}) from cluster {}",
                                    node.getDisplayName(), node.getServerIp(), config.getClusterId());
                            return eventLog.append(ClusterEvent.aboutNode(config.getClusterId(), node,
                                            ClusterEventType.NODE_REMOVED, EventSeverity.WARNING,
                                            "Node " + node.getDisplayName() + " removed from cluster", clock.instant()))
                                    .then(nodeRepository.deleteById(node.getId()))
                                    .thenReturn(node);
                        }));
    }

    /**
     * Takes this node out of its cluster and back to standalone.
     *
     * A main may only leave once no other members remain; it then clears the
     * roster. The event log is kept. The failover monitor and cache replication
     * are stopped.
     *
     * @return Mono with the standalone config
     */
    public Mono<ClusterConfig> leaveCluster() {
        return configStore.load()
                .filter(ClusterConfig::isClustered)
                .switchIfEmpty(Mono.error(() -> new ClusterConfigurationException("not part of a cluster")))
                .flatMap(config -> clearRoster(config)
                        .then(eventLog.append(ClusterEvent.local(config, ClusterEventType.NODE_LEFT,
                                EventSeverity.WARNING, "Server " + config.getServerIp() + " left the cluster",
                                clock.instant())))
                        .then(configStore.update(ClusterConfig::asStandalone))
                        .flatMap(standalone -> stopReplication().thenReturn(standalone)));
    }

    private Mono<Void> clearRoster(ClusterConfig config) {
        if (!config.isMain()) {
            return nodeRepository.deleteByHardwareId(config.getHardwareId()).then();
        }
        return nodeRepository.findByClusterId(config.getClusterId())
                .filter(node -> !node.isMain())
                .hasElements()
                .flatMap(hasMembers -> {
                    if (hasMembers) {
                        return Mono.error(new ClusterConfigurationException(
                                "cannot leave cluster while secondary servers are connected"));
                    }
                    return nodeRepository.deleteByClusterId(config.getClusterId())
                            .doOnNext(count -> log.info("Cleared {} roster row(s) of cluster {}",
                                    count, config.getClusterId()))
                            .then();
                });
    }

    private Mono<Void> stopReplication() {
        // stop() waits for an in-flight health check, keep it off the event loop
        return Mono.fromRunnable(failoverMonitor::stop)
                .subscribeOn(Schedulers.boundedElastic())
                .then(replicationDriver.stopCacheReplication(settings.getCacheCredential())
                        .timeout(settings.getReplicationCallTimeout()))
                .onErrorResume(error -> {
                    log.warn("Could not stop replication after leaving cluster: {}", error.getMessage());
                    return Mono.empty();
                });
    }

    // ========== Join helpers ==========

    private Mono<Void> firstJoin(ClusterConfig config, JoinRequest request, ServerRole role) {
        Instant now = clock.instant();
        ClusterNode node = ClusterNode.builder()
                .clusterId(config.getClusterId())
                .hardwareId(request.getHardwareId())
                .serverName(request.getServerName())
                .serverIp(request.getServerIp())
                .serverRole(role)
                .status(NodeStatus.ONLINE)
                .lastHeartbeat(now)
                .joinedAt(now)
                .build();
        return nodeRepository.save(node)
                .flatMap(saved -> {
                    log.info("Node {} ({}) joined cluster {} as {}",
                            saved.getDisplayName(), saved.getServerIp(), config.getClusterId(), role.getValue());
                    return eventLog.append(ClusterEvent.aboutNode(config.getClusterId(), saved,
                            ClusterEventType.NODE_JOINED, EventSeverity.INFO,
                            "Node " + saved.getDisplayName() + " joined cluster as " + role.getValue(), now));
                })
                .then();
    }

    private Mono<Void> rejoin(ClusterConfig config, ClusterNode existing, JoinRequest request, ServerRole role) {
        Instant now = clock.instant();
        ClusterNode updated = existing.toBuilder()
                .clusterId(config.getClusterId())
                .serverName(request.getServerName())
                .serverIp(request.getServerIp())
                .serverRole(role)
                .status(NodeStatus.ONLINE)
                .lastHeartbeat(now)
                .build();
        return nodeRepository.save(updated)
                .flatMap(saved -> {
                    log.info("Node {} ({}) rejoined cluster {}", saved.getDisplayName(), saved.getServerIp(),
                            config.getClusterId());
                    return eventLog.append(ClusterEvent.aboutNode(config.getClusterId(), saved,
                            ClusterEventType.NODE_REJOINED, EventSeverity.INFO,
                            "Node " + saved.getDisplayName() + " rejoined cluster", now));
                })
                .then();
    }

    private Mono<Void> reserveSlot(String slot) {
        return replicationDriver.ensureReplicationSlot(slot)
                .timeout(settings.getReplicationCallTimeout())
                .onErrorResume(error -> {
                    log.warn("Could not reserve replication slot {}: {}", slot, error.getMessage());
                    return Mono.empty();
                });
    }

    private Mono<ClusterNode> register(String clusterId, LocalNodeIdentity self, ServerRole role, Instant now) {
        ClusterNode row = ClusterNode.builder()
                .clusterId(clusterId)
                .hardwareId(self.getHardwareId())
                .serverName(self.getServerName())
                .serverIp(self.getServerIp())
                .serverRole(role)
                .status(NodeStatus.ONLINE)
                .lastHeartbeat(now)
                .joinedAt(now)
                .build();
        // A row left behind by an earlier cluster would shadow the new one
        return nodeRepository.deleteByHardwareId(self.getHardwareId())
                .then(nodeRepository.save(row));
    }

    private ClusterConfig joinedConfig(LocalNodeIdentity self, String clusterSecret, JoinResponse answer) {
        return ClusterConfig.builder()
                .clusterId(answer.getClusterId())
                .clusterSecret(clusterSecret)
                .hardwareId(self.getHardwareId())
                .serverName(self.getServerName())
                .serverIp(self.getServerIp())
                .serverRole(answer.getAssignedRole() != null ? answer.getAssignedRole() : ServerRole.SECONDARY)
                .apiRole(ApiRole.STANDBY)
                .radiusRole(RadiusRole.BACKUP)
                .mainServerIp(answer.getMainServerIp())
                .mainServerPort(settings.getPeerPort())
                .autoFailoverEnabled(true)
                .lastHeartbeat(clock.instant())
                .build();
    }

    private Mono<Void> followMain(ClusterConfig joined) {
        String mainIp = joined.getMainServerIp();
        String slot = ReplicationSlots.forHardwareId(joined.getHardwareId());
        Mono<Void> dataStore = replicationDriver.demoteToReplica(mainIp, slot)
                .timeout(settings.getReplicationCallTimeout())
                .onErrorResume(error -> {
                    log.warn("Could not point data store at {} (slot {}): {}", mainIp, slot, error.getMessage());
                    return Mono.empty();
                });
        Mono<Void> cache = replicationDriver.followCache(mainIp, settings.getCacheCredential())
                .timeout(settings.getReplicationCallTimeout())
                .onErrorResume(error -> {
                    log.warn("Could not point cache at {}: {}", mainIp, error.getMessage());
                    return Mono.empty();
                });
        Mono<Void> monitor = Mono.fromRunnable(failoverMonitor::start)
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(error -> {
                    log.warn("Could not start failover monitor: {}", error.getMessage());
                    return Mono.empty();
                })
                .then();
        return dataStore.then(cache).then(monitor);
    }

    private LocalNodeIdentity localIdentity(Optional<ClusterConfig> existing, String serverName, String serverIp,
                                            String defaultName) {
        LocalNodeIdentity base = existing
                .map(config -> identity.toBuilder()
                        .hardwareId(config.getHardwareId())
                        .serverIp(config.getServerIp())
                        .serverName(config.getServerName())
                        .build())
                .orElse(identity);
        LocalNodeIdentity self = base.withOverrides(serverIp, serverName);
        return isBlank(self.getServerName()) ? self.withOverrides(null, defaultName) : self;
    }

    private static ServerRole joinableRole(ServerRole requested) {
        if (requested == null) {
            return ServerRole.SECONDARY;
        }
        if (requested != ServerRole.SECONDARY && requested != ServerRole.SERVER3) {
            throw new ClusterConfigurationException("cannot join a cluster as " + requested.getValue());
        }
        return requested;
    }

    private static ClusterConfigurationException alreadyClustered(ClusterConfig config) {
        return new ClusterConfigurationException("already part of cluster " + config.getClusterId()
                + " - leave it first");
    }

    String newClusterId() {
        byte[] bytes = new byte[CLUSTER_ID_BYTES];
        random.nextBytes(bytes);
        return CLUSTER_ID_PREFIX + HexFormat.of().formatHex(bytes);
    }

    /**
     * Four dash-separated groups of four hex digits.
     */
    String newClusterSecret() {
        byte[] bytes = new byte[SECRET_BYTES];
        random.nextBytes(bytes);
        String hex = HexFormat.of().formatHex(bytes);
        return String.join("-", hex.substring(0, 4), hex.substring(4, 8), hex.substring(8, 12), hex.substring(12, 16));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static ClusterStatusView toView(ClusterConfig config, List<ClusterNode> nodes, List<ClusterEvent> events) {
        int online = (int) nodes.stream().filter(ClusterNode::isOnline).count();
        return ClusterStatusView.builder()
                .clusterId(config.getClusterId())
                .clustered(true)
                .serverRole(config.getServerRole())
                .mainServerIp(config.getMainServerIp())
                .autoFailoverEnabled(config.isAutoFailoverEnabled())
                .totalNodes(nodes.size())
                .onlineNodes(online)
                .nodes(nodes)
                .recentEvents(events)
                .build();
    }
}

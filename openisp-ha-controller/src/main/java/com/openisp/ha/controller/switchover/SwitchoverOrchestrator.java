package com.openisp.ha.controller.switchover;

import com.openisp.ha.controller.config.FailoverSettings;
import com.openisp.ha.controller.exception.ClusterConfigurationException;
import com.openisp.ha.controller.exception.FailoverPipelineException;
import com.openisp.ha.controller.peer.IPeerNotifier;
import com.openisp.ha.controller.replication.IReplicationDriver;
import com.openisp.ha.controller.replication.ReplicationSlots;
import com.openisp.ha.controller.store.IClusterConfigStore;
import com.openisp.ha.controller.store.IClusterEventLog;
import com.openisp.ha.controller.store.IClusterNodeRepository;
import com.openisp.ha.model.ClusterConfig;
import com.openisp.ha.model.ClusterEvent;
import com.openisp.ha.model.ClusterEventType;
import com.openisp.ha.model.ClusterNode;
import com.openisp.ha.model.EventSeverity;
import com.openisp.ha.model.NodeStatus;
import com.openisp.ha.model.ServerRole;
import com.openisp.ha.model.peer.PeerEvent;
import com.openisp.ha.model.peer.PromoteRequest;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Planned hand-over of the main role from this node to a caught-up secondary.
 *
 * <ol>
 *   <li>reject if not main, target unknown, or target lag above the limit</li>
 *   <li>fence local writes and wait for the settle delay</li>
 *   <li>ask the target to promote itself; on failure unfence and abort</li>
 *   <li>demote the local data store to follow the target</li>
 *   <li>persist the secondary config</li>
 * </ol>
 *
 * Every rejection in step 1 happens before any side effect.
 */
@Slf4j
public class SwitchoverOrchestrator {

    private final IClusterConfigStore configStore;
    private final IClusterNodeRepository nodeRepository;
    private final IClusterEventLog eventLog;
    private final IReplicationDriver replicationDriver;
    private final IPeerNotifier peerNotifier;
    private final FailoverSettings settings;
    private final Clock clock;
    private final Scheduler delayScheduler;

    public SwitchoverOrchestrator(IClusterConfigStore configStore,
                                  IClusterNodeRepository nodeRepository,
                                  IClusterEventLog eventLog,
                                  IReplicationDriver replicationDriver,
                                  IPeerNotifier peerNotifier,
                                  FailoverSettings settings,
                                  Clock clock,
                                  Scheduler delayScheduler) {
        this.configStore = Objects.requireNonNull(configStore);
        this.nodeRepository = Objects.requireNonNull(nodeRepository);
        this.eventLog = Objects.requireNonNull(eventLog);
        this.replicationDriver = Objects.requireNonNull(replicationDriver);
        this.peerNotifier = Objects.requireNonNull(peerNotifier);
        this.settings = Objects.requireNonNull(settings);
        this.clock = Objects.requireNonNull(clock);
        this.delayScheduler = Objects.requireNonNull(delayScheduler);
    }

    /**
     * Hands the main role to the given roster member.
     *
     * @param secondaryNodeId roster id of the target
     * @return Mono with the result; signals {@link ClusterConfigurationException} on a
     *         rejected precondition and {@link FailoverPipelineException} on a failed step
     */
    public Mono<SwitchoverResult> switchoverTo(long secondaryNodeId) {
        return configStore.load()
                .switchIfEmpty(Mono.error(ClusterConfigurationException::notConfigured))
                .flatMap(config -> {
                    if (!config.isMain()) {
                        return Mono.error(new ClusterConfigurationException(
                                "can only initiate switchover from main server"));
                    }
                    return nodeRepository.findById(secondaryNodeId)
                            .flatMap(found -> found
                                    .map(target -> checkLagAndRun(config, target))
                                    .orElseGet(() -> Mono.error(
                                            new ClusterConfigurationException("secondary node not found"))));
                });
    }

    // ========== Steps ==========

    private Mono<SwitchoverResult> checkLagAndRun(ClusterConfig config, ClusterNode target) {
        return replicationDriver.replicationLagBytes(target.getServerIp())
                .timeout(settings.getReplicationCallTimeout())
                .onErrorMap(error -> new FailoverPipelineException(
                        "could not read replication lag of " + target.getServerIp() + ": " + error.getMessage(), error))
                .defaultIfEmpty(0L)
                .flatMap(lagBytes -> {
                    if (lagBytes > settings.getSwitchoverMaxLagBytes()) {
                        return Mono.error(new ClusterConfigurationException(String.format(
                                "replication lag too high (%d bytes), wait for sync", lagBytes)));
                    }
                    return run(config, target, lagBytes);
                });
    }

    private Mono<SwitchoverResult> run(ClusterConfig config, ClusterNode target, long lagBytes) {
        Instant startedAt = clock.instant();
        String slotName = slotNameFor(config.getHardwareId());
        log.warn("Switchover: handing main role from {} to {} (lag {} bytes)",
                config.getServerIp(), target.getServerIp(), lagBytes);

        return record(config, target, ClusterEventType.SWITCHOVER_STARTED, EventSeverity.WARNING,
                        "Switchover started from " + config.getServerIp() + " to " + target.getServerIp())
                .then(fence())
                .then(Mono.delay(settings.getSwitchoverSettleDelay(), delayScheduler))
                .then(requestPromotion(config, target))
                .then(demote(config, target, slotName))
                .then(Mono.defer(() -> {
                    log.warn("Switchover complete: this server is now a secondary of {}", target.getServerIp());
                    return record(config, target, ClusterEventType.SWITCHOVER_COMPLETED, EventSeverity.WARNING,
                            "Switchover complete. New main: " + target.getServerIp());
                }))
                .then(Mono.fromSupplier(() -> SwitchoverResult.builder()
                        .formerMainIp(config.getServerIp())
                        .newMainIp(target.getServerIp())
                        .targetNodeId(target.getId())
                        .replicationLagBytes(lagBytes)
                        .replicationSlot(slotName)
                        .startedAt(startedAt)
                        .completedAt(clock.instant())
                        .build()));
    }

    private Mono<Void> fence() {
        log.info("Switchover: fencing current main (stopping writes)");
        return replicationDriver.setWritesFenced(true)
                .timeout(settings.getReplicationCallTimeout())
                .onErrorMap(error -> new FailoverPipelineException("failed to fence writes: " + error.getMessage(), error));
    }

    private Mono<Void> requestPromotion(ClusterConfig config, ClusterNode target) {
        log.info("Switchover: asking {} to promote", target.getServerIp());
        PromoteRequest request = PromoteRequest.of(
                PeerEvent.SWITCHOVER, config.getServerIp(), config.getClusterId(), config.getClusterSecret());

        return peerNotifier.requestPromotion(target, request)
                .onErrorResume(error -> {
                    log.error("Switchover: target {} did not accept promotion, unfencing: {}",
                            target.getServerIp(), error.getMessage());
                    FailoverPipelineException failure = new FailoverPipelineException(
                            "failed to contact secondary: " + error.getMessage(), error);
                    return replicationDriver.setWritesFenced(false)
                            .timeout(settings.getReplicationCallTimeout())
                            .onErrorResume(unfenceError -> {
                                log.error("Switchover: failed to unfence writes: {}", unfenceError.getMessage());
                                return Mono.empty();
                            })
                            .then(record(config, target, ClusterEventType.SWITCHOVER_FAILED, EventSeverity.CRITICAL,
                                    "Switchover failed: " + failure.getMessage()))
                            .then(Mono.error(failure));
                });
    }

    private Mono<Void> demote(ClusterConfig config, ClusterNode target, String slotName) {
        log.info("Switchover: demoting self to replica of {}", target.getServerIp());
        return replicationDriver.demoteToReplica(target.getServerIp(), slotName)
                .timeout(settings.getReplicationCallTimeout())
                .then(Mono.<FailoverPipelineException>empty())
                .onErrorResume(error -> Mono.just(new FailoverPipelineException(
                        "demotion to replica failed: " + error.getMessage(), error)))
                // The target has already promoted itself, so the config follows it either way
                .flatMap(failure -> persistDemotion(config, target)
                        .then(record(config, target, ClusterEventType.SWITCHOVER_FAILED, EventSeverity.CRITICAL,
                                "Switchover failed: " + failure.getMessage()))
                        .then(Mono.<Void>error(failure)))
                .switchIfEmpty(persistDemotion(config, target));
    }

    private Mono<Void> persistDemotion(ClusterConfig config, ClusterNode target) {
        return configStore.update(current -> current.demotedToSecondary(target.getServerIp()))
                .then(nodeRepository.updateRoleAndStatusByHardwareId(
                        config.getHardwareId(), ServerRole.SECONDARY, NodeStatus.ONLINE))
                .onErrorResume(error -> {
                    log.error("Switchover: failed to persist secondary config: {}", error.getMessage());
                    return Mono.empty();
                })
                .then();
    }

    private Mono<Void> record(ClusterConfig config, ClusterNode target, ClusterEventType type,
                              EventSeverity severity, String description) {
        return eventLog.append(ClusterEvent.aboutNode(config.getClusterId(), target, type, severity, description,
                        clock.instant()))
                .onErrorResume(error -> {
                    log.error("Failed to record {} event: {}", type.getValue(), error.getMessage());
                    return Mono.empty();
                })
                .then();
    }

    static String slotNameFor(String hardwareId) {
        return ReplicationSlots.forHardwareId(hardwareId);
    }
}

package com.openisp.ha.controller.failover;

import com.openisp.ha.controller.config.FailoverSettings;
import com.openisp.ha.controller.exception.ClusterConfigurationException;
import com.openisp.ha.controller.exception.FailoverPipelineException;
import com.openisp.ha.controller.peer.IPeerNotifier;
import com.openisp.ha.controller.peer.PeerBroadcastResult;
import com.openisp.ha.controller.replication.IReplicationDriver;
import com.openisp.ha.controller.service.IDependentServiceController;
import com.openisp.ha.controller.store.IClusterConfigStore;
import com.openisp.ha.controller.store.IClusterEventLog;
import com.openisp.ha.controller.store.IClusterNodeRepository;
import com.openisp.ha.model.ClusterConfig;
import com.openisp.ha.model.ClusterEvent;
import com.openisp.ha.model.ClusterEventType;
import com.openisp.ha.model.EventSeverity;
import com.openisp.ha.model.NodeStatus;
import com.openisp.ha.model.ServerRole;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the promotion pipeline that turns this node into the cluster main.
 *
 * Steps, in order:
 * <ol>
 *   <li>record {@code failover_started}</li>
 *   <li>check replication lag (warning only)</li>
 *   <li>promote the local data store (fatal on failure)</li>
 *   <li>stop cache replication (best effort)</li>
 *   <li>persist the promoted config</li>
 *   <li>mark the former main offline and this node main in the roster</li>
 *   <li>announce the new main to every other roster member</li>
 *   <li>restart the authentication service (warning only)</li>
 *   <li>record {@code failover_completed}</li>
 * </ol>
 *
 * Nothing is rolled back once the data store is promoted. The guard is released
 * when the run finishes, whatever the outcome.
 */
@Slf4j
public class FailoverOrchestrator {

    private final IClusterConfigStore configStore;
    private final IClusterNodeRepository nodeRepository;
    private final IClusterEventLog eventLog;
    private final IReplicationDriver replicationDriver;
    private final IPeerNotifier peerNotifier;
    private final IDependentServiceController serviceController;
    private final FailoverGuard guard;
    private final FailoverSettings settings;
    private final Clock clock;
    private final Scheduler scheduler;

    public FailoverOrchestrator(IClusterConfigStore configStore,
                                IClusterNodeRepository nodeRepository,
                                IClusterEventLog eventLog,
                                IReplicationDriver replicationDriver,
                                IPeerNotifier peerNotifier,
                                IDependentServiceController serviceController,
                                FailoverGuard guard,
                                FailoverSettings settings,
                                Clock clock,
                                Scheduler scheduler) {
        this.configStore = Objects.requireNonNull(configStore);
        this.nodeRepository = Objects.requireNonNull(nodeRepository);
        this.eventLog = Objects.requireNonNull(eventLog);
        this.replicationDriver = Objects.requireNonNull(replicationDriver);
        this.peerNotifier = Objects.requireNonNull(peerNotifier);
        this.serviceController = Objects.requireNonNull(serviceController);
        this.guard = Objects.requireNonNull(guard);
        this.settings = Objects.requireNonNull(settings);
        this.clock = Objects.requireNonNull(clock);
        this.scheduler = Objects.requireNonNull(scheduler);
    }

    public FailoverGuard getGuard() {
        return guard;
    }

    /**
     * Starts a run in the background. The caller must already hold the guard.
     *
     * @param trigger what caused the run
     * @return future completing with the run's result; never completes exceptionally
     * @throws IllegalStateException if the guard is not held
     */
    public CompletableFuture<FailoverResult> launch(FailoverTrigger trigger) {
        if (!guard.isInProgress()) {
            throw new IllegalStateException("failover guard must be acquired before launching a run");
        }
        Instant startedAt = clock.instant();
        // Released before the result reaches the future, so a caller woken by it can acquire again.
        // The flag keeps the trailing doFinally from releasing a guard that a newer run already holds.
        AtomicBoolean released = new AtomicBoolean(false);
        Runnable releaseOnce = () -> {
            if (released.compareAndSet(false, true)) {
                guard.release();
            }
        };
        CompletableFuture<FailoverResult> run = execute(trigger)
                .onErrorResume(error -> {
                    log.error("Failover ({}) aborted: {}", trigger, error.getMessage());
                    return Mono.just(FailoverResult.failed(trigger, error.getMessage(), startedAt, clock.instant()));
                })
                .subscribeOn(scheduler)
                .doOnNext(result -> releaseOnce.run())
                .doFinally(signal -> releaseOnce.run())
                .toFuture();
        guard.track(run);
        return run;
    }

    /**
     * Runs the pipeline. Does not touch the guard.
     *
     * @param trigger what caused the run
     * @return Mono with the result; a promotion failure yields a FAILED result,
     *         a missing config signals {@link ClusterConfigurationException}
     */
    public Mono<FailoverResult> execute(FailoverTrigger trigger) {
        return configStore.load()
                .switchIfEmpty(Mono.error(ClusterConfigurationException::notConfigured))
                .flatMap(config -> runPipeline(config, trigger));
    }

    // ========== Pipeline ==========

    private Mono<FailoverResult> runPipeline(ClusterConfig config, FailoverTrigger trigger) {
        Instant startedAt = clock.instant();
        // Captured before the config update rewrites mainServerIp to this node
        String formerMainIp = config.getMainServerIp();
        FailoverResult.FailoverResultBuilder result = FailoverResult.builder()
                .trigger(trigger)
                .formerMainIp(formerMainIp)
                .startedAt(startedAt);

        log.warn("=== Cluster failover starting ({}) on {} ===", trigger, config.getServerIp());

        return record(config, ClusterEventType.FAILOVER_STARTED, describeStart(trigger, formerMainIp))
                .then(checkReplicationLag(result))
                .then(promoteDataStore())
                .then(stopCacheReplication())
                .then(persistPromotion())
                .flatMap(promoted -> updateRoster(promoted, formerMainIp)
                        .then(announceNewMain(promoted))
                        .doOnNext(result::peers)
                        .then(restartAuthenticationService())
                        .doOnNext(result::authServiceRestarted)
                        .then(record(promoted, ClusterEventType.FAILOVER_COMPLETED,
                                "Failover complete. New main: " + promoted.getServerIp()))
                        .thenReturn(promoted))
                .map(promoted -> {
                    log.warn("=== Cluster failover complete: {} is now the main server ===", promoted.getServerIp());
                    return result.status(FailoverResult.Status.COMPLETED)
                            .newMainIp(promoted.getServerIp())
                            .completedAt(clock.instant())
                            .build();
                })
                .onErrorResume(FailoverPipelineException.class, error -> recordFailure(config, result, error));
    }

    private Mono<Void> checkReplicationLag(FailoverResult.FailoverResultBuilder result) {
        log.info("Failover step: checking replication lag");
        return replicationDriver.replicationLagSeconds()
                .timeout(settings.getReplicationCallTimeout())
                .doOnNext(lag -> {
                    result.replicationLagSeconds(lag);
                    if (lag > settings.getReplicationLagWarning().getSeconds()) {
                        log.warn("Replication lag is {} seconds, data loss possible", lag);
                    }
                })
                .onErrorResume(error -> {
                    log.warn("Could not read replication lag: {}", error.getMessage());
                    return Mono.empty();
                })
                .then();
    }

    private Mono<Void> promoteDataStore() {
        log.info("Failover step: promoting local data store to primary");
        return replicationDriver.promoteToMain()
                .timeout(settings.getReplicationCallTimeout())
                .onErrorMap(error -> new FailoverPipelineException(
                        "data store promotion failed: " + error.getMessage(), error));
    }

    private Mono<Void> stopCacheReplication() {
        log.info("Failover step: stopping cache replication");
        return replicationDriver.stopCacheReplication(settings.getCacheCredential())
                .timeout(settings.getReplicationCallTimeout())
                .onErrorResume(error -> {
                    log.warn("Could not stop cache replication: {}", error.getMessage());
                    return Mono.empty();
                });
    }

    private Mono<ClusterConfig> persistPromotion() {
        log.info("Failover step: updating cluster configuration");
        return configStore.update(current -> current.promotedToMain(clock.instant()))
                .switchIfEmpty(Mono.error(() -> new FailoverPipelineException("cluster config disappeared during failover")))
                .onErrorMap(error -> !(error instanceof FailoverPipelineException),
                        error -> new FailoverPipelineException("failed to save promoted config: " + error.getMessage(), error));
    }

    private Mono<Void> updateRoster(ClusterConfig promoted, String formerMainIp) {
        log.info("Failover step: updating node statuses");
        Mono<Integer> markFormerMainOffline = formerMainIp == null || formerMainIp.equals(promoted.getServerIp())
                ? Mono.just(0)
                : nodeRepository.updateStatusByServerIp(formerMainIp, NodeStatus.OFFLINE);

        return markFormerMainOffline
                .doOnNext(count -> log.info("Marked {} roster row(s) of former main {} offline", count, formerMainIp))
                .then(nodeRepository.updateRoleAndStatusByHardwareId(
                        promoted.getHardwareId(), ServerRole.MAIN, NodeStatus.ONLINE))
                .doOnNext(updated -> {
                    if (!updated) {
                        log.warn("No roster row for hardware id {}", promoted.getHardwareId());
                    }
                })
                .onErrorResume(error -> {
                    log.warn("Could not update roster: {}", error.getMessage());
                    return Mono.empty();
                })
                .then();
    }

    private Mono<PeerBroadcastResult> announceNewMain(ClusterConfig promoted) {
        log.info("Failover step: notifying other cluster nodes");
        return nodeRepository.findByClusterId(promoted.getClusterId())
                .filter(node -> !node.getHardwareId().equals(promoted.getHardwareId()))
                .collectList()
                .flatMap(peers -> peerNotifier.broadcastNewMain(promoted, peers))
                .doOnNext(outcome -> {
                    if (!outcome.isFullyDelivered()) {
                        log.warn("New main announcement failed for {}", outcome.getFailed().keySet());
                    }
                })
                .onErrorResume(error -> {
                    log.warn("Could not notify cluster nodes: {}", error.getMessage());
                    return Mono.just(PeerBroadcastResult.empty());
                });
    }

    private Mono<Boolean> restartAuthenticationService() {
        log.info("Failover step: restarting authentication service");
        return serviceController.restartAuthenticationService()
                .thenReturn(true)
                .onErrorResume(error -> {
                    log.warn("Could not restart authentication service: {}", error.getMessage());
                    return Mono.just(false);
                });
    }

    // ========== Events ==========

    private Mono<FailoverResult> recordFailure(ClusterConfig config,
                                               FailoverResult.FailoverResultBuilder result,
                                               FailoverPipelineException error) {
        log.error("Cluster failover failed: {}", error.getMessage());
        return record(config, ClusterEventType.FAILOVER_FAILED, "Failover failed: " + error.getMessage())
                .then(Mono.fromSupplier(() -> result.status(FailoverResult.Status.FAILED)
                        .errorMessage(error.getMessage())
                        .completedAt(clock.instant())
                        .build()));
    }

    private Mono<Void> record(ClusterConfig config, ClusterEventType type, String description) {
        return eventLog.append(ClusterEvent.local(config, type, EventSeverity.CRITICAL, description, clock.instant()))
                .onErrorResume(error -> {
                    log.error("Failed to record {} event: {}", type.getValue(), error.getMessage());
                    return Mono.empty();
                })
                .then();
    }

    private static String describeStart(FailoverTrigger trigger, String formerMainIp) {
        return switch (trigger) {
            case AUTOMATIC -> "Auto-failover initiated due to main server failure (" + formerMainIp + ")";
            case SWITCHOVER -> "Switchover promotion requested by " + formerMainIp;
            default -> "Promotion requested by " + formerMainIp;
        };
    }
}

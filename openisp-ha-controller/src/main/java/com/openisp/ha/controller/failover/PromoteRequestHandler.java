package com.openisp.ha.controller.failover;

import com.openisp.ha.controller.exception.ClusterConfigurationException;
import com.openisp.ha.controller.peer.PeerAuthenticator;
import com.openisp.ha.controller.store.IClusterConfigStore;
import com.openisp.ha.controller.store.IClusterEventLog;
import com.openisp.ha.model.ClusterConfig;
import com.openisp.ha.model.ClusterEvent;
import com.openisp.ha.model.ClusterEventType;
import com.openisp.ha.model.EventSeverity;
import com.openisp.ha.model.peer.PeerEvent;
import com.openisp.ha.model.peer.PromoteRequest;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handles {@code POST /cluster/promote} on a secondary.
 *
 * Validates the request, acknowledges it and runs the failover pipeline in the
 * background. Shares the {@link FailoverGuard} with the monitor, so a request
 * arriving while a failover is running is acknowledged without starting another.
 */
@Slf4j
public class PromoteRequestHandler {

    private final IClusterConfigStore configStore;
    private final IClusterEventLog eventLog;
    private final FailoverOrchestrator orchestrator;
    private final Clock clock;

    public PromoteRequestHandler(IClusterConfigStore configStore,
                                 IClusterEventLog eventLog,
                                 FailoverOrchestrator orchestrator,
                                 Clock clock) {
        this.configStore = Objects.requireNonNull(configStore);
        this.eventLog = Objects.requireNonNull(eventLog);
        this.orchestrator = Objects.requireNonNull(orchestrator);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Validates and acts on a promotion request.
     *
     * @return Mono with the acknowledgement; signals
     *         {@link ClusterConfigurationException} if this node is not a configured secondary and
     *         {@link com.openisp.ha.controller.exception.ClusterAuthenticationException} on a bad secret
     */
    public Mono<PromotionAck> handle(PromoteRequest request) {
        return configStore.load()
                .switchIfEmpty(Mono.error(ClusterConfigurationException::notConfigured))
                .flatMap(config -> {
                    PeerAuthenticator.verify(config, request.getClusterSecret());
                    if (!config.isSecondary()) {
                        return Mono.error(new ClusterConfigurationException(
                                "this server is not a secondary - cannot be promoted"));
                    }
                    return initiate(config, request);
                });
    }

    private Mono<PromotionAck> initiate(ClusterConfig config, PromoteRequest request) {
        FailoverGuard guard = orchestrator.getGuard();
        if (!guard.tryAcquire()) {
            log.warn("Promotion request from {} ignored: failover already in progress", request.getCurrentMain());
            return Mono.just(PromotionAck.alreadyInProgress());
        }

        FailoverTrigger trigger = request.getEvent() == PeerEvent.SWITCHOVER
                ? FailoverTrigger.SWITCHOVER
                : FailoverTrigger.PEER_PROMOTE;
        String eventName = request.getEvent() != null ? request.getEvent().getValue() : "unspecified";
        log.warn("Received promotion request from {} (event: {})", request.getCurrentMain(), eventName);

        // The guard belongs to this request until the launch takes it over, or until cancellation gives it back.
        AtomicBoolean handedOver = new AtomicBoolean(false);
        return eventLog.append(ClusterEvent.local(config, ClusterEventType.PROMOTION_RECEIVED, EventSeverity.WARNING,
                        "Promotion request received from " + request.getCurrentMain(), clock.instant()))
                .onErrorResume(error -> {
                    log.error("Failed to record promotion event: {}", error.getMessage());
                    return Mono.empty();
                })
                .then(Mono.fromSupplier(() -> {
                    if (!handedOver.compareAndSet(false, true)) {
                        return PromotionAck.alreadyInProgress();
                    }
                    return PromotionAck.initiated(orchestrator.launch(trigger));
                }))
                .doOnCancel(() -> {
                    if (handedOver.compareAndSet(false, true)) {
                        log.warn("Promotion request from {} cancelled before failover started", request.getCurrentMain());
                        guard.release();
                    }
                });
    }
}

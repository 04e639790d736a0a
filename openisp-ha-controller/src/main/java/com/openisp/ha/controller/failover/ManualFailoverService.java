package com.openisp.ha.controller.failover;

import com.openisp.ha.controller.exception.ClusterConfigurationException;
import com.openisp.ha.controller.peer.IPeerNotifier;
import com.openisp.ha.controller.store.IClusterConfigStore;
import com.openisp.ha.controller.store.IClusterEventLog;
import com.openisp.ha.controller.store.IClusterNodeRepository;
import com.openisp.ha.model.ClusterConfig;
import com.openisp.ha.model.ClusterEvent;
import com.openisp.ha.model.ClusterEventType;
import com.openisp.ha.model.ClusterNode;
import com.openisp.ha.model.EventSeverity;
import com.openisp.ha.model.peer.PeerEvent;
import com.openisp.ha.model.peer.PromoteRequest;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Objects;

/**
 * Operator-initiated failover, run on the main.
 *
 * Asks an online roster member to promote itself. This node keeps its own role;
 * it learns about the new main through the target's {@code new_main} broadcast.
 */
@Slf4j
public class ManualFailoverService {

    private final IClusterConfigStore configStore;
    private final IClusterNodeRepository nodeRepository;
    private final IClusterEventLog eventLog;
    private final IPeerNotifier peerNotifier;
    private final Clock clock;

    public ManualFailoverService(IClusterConfigStore configStore,
                                 IClusterNodeRepository nodeRepository,
                                 IClusterEventLog eventLog,
                                 IPeerNotifier peerNotifier,
                                 Clock clock) {
        this.configStore = Objects.requireNonNull(configStore);
        this.nodeRepository = Objects.requireNonNull(nodeRepository);
        this.eventLog = Objects.requireNonNull(eventLog);
        this.peerNotifier = Objects.requireNonNull(peerNotifier);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Requests promotion of the given roster member. Every precondition is checked
     * before any network call is made.
     *
     * @param targetNodeId roster id of the node to promote
     * @return Mono with the target node once it accepted the request
     */
    public Mono<ClusterNode> initiate(long targetNodeId) {
        return configStore.load()
                .switchIfEmpty(Mono.error(ClusterConfigurationException::notConfigured))
                .flatMap(config -> {
                    if (!config.isMain()) {
                        return Mono.error(new ClusterConfigurationException(
                                "can only initiate failover from main server"));
                    }
                    return nodeRepository.findById(targetNodeId)
                            .flatMap(found -> {
                                if (found.isEmpty()) {
                                    return Mono.error(new ClusterConfigurationException("target node not found"));
                                }
                                ClusterNode target = found.get();
                                if (!target.isOnline()) {
                                    return Mono.error(new ClusterConfigurationException("target node is not online"));
                                }
                                return requestPromotion(config, target);
                            });
                });
    }

    private Mono<ClusterNode> requestPromotion(ClusterConfig config, ClusterNode target) {
        log.warn("Manual failover: asking {} ({}) to become main", target.getDisplayName(), target.getServerIp());
        PromoteRequest request = PromoteRequest.of(
                PeerEvent.PROMOTE_TO_MAIN, config.getServerIp(), config.getClusterId(), config.getClusterSecret());

        return peerNotifier.requestPromotion(target, request)
                .then(eventLog.append(ClusterEvent.aboutNode(config.getClusterId(), target,
                        ClusterEventType.MANUAL_FAILOVER, EventSeverity.WARNING,
                        "Manual failover initiated to " + target.getDisplayName(), clock.instant())))
                .thenReturn(target);
    }
}

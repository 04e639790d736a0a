package com.openisp.ha.controller.failover;

import com.openisp.ha.controller.config.FailoverSettings;
import com.openisp.ha.controller.exception.ClusterConfigurationException;
import com.openisp.ha.controller.peer.PeerAuthenticator;
import com.openisp.ha.controller.replication.IReplicationDriver;
import com.openisp.ha.controller.store.IClusterConfigStore;
import com.openisp.ha.controller.store.IClusterEventLog;
import com.openisp.ha.model.ClusterConfig;
import com.openisp.ha.model.ClusterEvent;
import com.openisp.ha.model.ClusterEventType;
import com.openisp.ha.model.EventSeverity;
import com.openisp.ha.model.peer.NotifyRequest;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Objects;

/**
 * Handles {@code POST /cluster/notify}: a peer announcing a cluster change.
 *
 * On {@code new_main} the local config is repointed and, unless this node is
 * itself main, the cache is told to follow the new main.
 */
@Slf4j
public class NotifyRequestHandler {

    private final IClusterConfigStore configStore;
    private final IClusterEventLog eventLog;
    private final IReplicationDriver replicationDriver;
    private final FailoverSettings settings;
    private final Clock clock;

    public NotifyRequestHandler(IClusterConfigStore configStore,
                                IClusterEventLog eventLog,
                                IReplicationDriver replicationDriver,
                                FailoverSettings settings,
                                Clock clock) {
        this.configStore = Objects.requireNonNull(configStore);
        this.eventLog = Objects.requireNonNull(eventLog);
        this.replicationDriver = Objects.requireNonNull(replicationDriver);
        this.settings = Objects.requireNonNull(settings);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * @return Mono with the config after processing
     */
    public Mono<ClusterConfig> handle(NotifyRequest request) {
        return configStore.load()
                .switchIfEmpty(Mono.error(ClusterConfigurationException::notConfigured))
                .flatMap(config -> {
                    PeerAuthenticator.verify(config, request.getClusterSecret());
                    log.info("Received cluster notification: {}", request.getEvent());

                    if (request.getEvent() == null) {
                        log.warn("Cluster notification without event ignored");
                        return Mono.just(config);
                    }
                    return switch (request.getEvent()) {
                        case NEW_MAIN -> acknowledgeNewMain(request.getNewMainIp());
                        case CONFIG_UPDATE -> {
                            log.info("Config update notification received");
                            yield Mono.just(config);
                        }
                        default -> {
                            log.warn("Unknown cluster event: {}", request.getEvent().getValue());
                            yield Mono.just(config);
                        }
                    };
                });
    }

    private Mono<ClusterConfig> acknowledgeNewMain(String newMainIp) {
        if (newMainIp == null || newMainIp.isBlank()) {
            return Mono.error(new ClusterConfigurationException("new_main_ip is required"));
        }
        return configStore.update(current -> current.withMainServerIp(newMainIp))
                .switchIfEmpty(Mono.error(ClusterConfigurationException::notConfigured))
                .flatMap(updated -> eventLog.append(ClusterEvent.local(updated, ClusterEventType.NEW_MAIN_ACKNOWLEDGED,
                                EventSeverity.INFO, "Acknowledged new main server: " + newMainIp, clock.instant()))
                        .then(updated.isMain() ? Mono.<Void>empty() : followNewMain(newMainIp))
                        .thenReturn(updated));
    }

    private Mono<Void> followNewMain(String newMainIp) {
        log.info("Reconfiguring cache replication to new main {}", newMainIp);
        return replicationDriver.followCache(newMainIp, settings.getCacheCredential())
                .timeout(settings.getReplicationCallTimeout())
                .onErrorResume(error -> {
                    log.warn("Could not repoint cache to {}: {}", newMainIp, error.getMessage());
                    return Mono.empty();
                });
    }
}

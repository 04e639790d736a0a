package com.openisp.ha.controller.failover;

import com.openisp.ha.controller.config.FailoverSettings;
import com.openisp.ha.controller.health.HealthCheckResult;
import com.openisp.ha.controller.health.IMainHealthProbe;
import com.openisp.ha.controller.replication.IReplicationDriver;
import com.openisp.ha.controller.store.IClusterConfigStore;
import com.openisp.ha.model.ClusterConfig;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Background health monitor run by a secondary node.
 *
 * Polls the main server's {@code /health} endpoint every check interval. A
 * successful poll refreshes the heartbeat in the {@link FailoverGuard}; once the
 * main has been silent for the failover threshold the monitor acquires the
 * guard and launches an automatic failover. Detection is purely local: there is
 * no quorum, so a partitioned secondary will promote itself.
 *
 * Only runs on a secondary with auto-failover enabled and a known main address.
 * A local data store that reports it is in recovery overrides the persisted role,
 * both when starting and on every check.
 */
@Slf4j
public class FailoverMonitor {

    private static final Duration LIFECYCLE_TIMEOUT = Duration.ofSeconds(5);

    private final IClusterConfigStore configStore;
    private final IReplicationDriver replicationDriver;
    private final IMainHealthProbe healthProbe;
    private final FailoverOrchestrator orchestrator;
    private final FailoverGuard guard;
    private final FailoverSettings settings;

    private final Object lifecycleLock = new Object();
    private ScheduledExecutorService monitorExecutor;
    private ScheduledFuture<?> monitorTask;
    private volatile boolean running;

    public FailoverMonitor(IClusterConfigStore configStore,
                           IReplicationDriver replicationDriver,
                           IMainHealthProbe healthProbe,
                           FailoverOrchestrator orchestrator,
                           FailoverSettings settings) {
        this.configStore = Objects.requireNonNull(configStore);
        this.replicationDriver = Objects.requireNonNull(replicationDriver);
        this.healthProbe = Objects.requireNonNull(healthProbe);
        this.orchestrator = Objects.requireNonNull(orchestrator);
        this.guard = orchestrator.getGuard();
        this.settings = Objects.requireNonNull(settings);
    }

    /**
     * Starts monitoring if this node qualifies. Does nothing if already running.
     *
     * @return true if the monitor is running after the call
     */
    public boolean start() {
        synchronized (lifecycleLock) {
            if (running) {
                log.debug("Failover monitor already running");
                return true;
            }

            ClusterConfig config = configStore.load().block(settings.getReplicationCallTimeout());
            if (config == null) {
                log.info("Failover monitor not started: cluster not configured");
                return false;
            }

            boolean inRecovery = isLocalStoreInRecovery();
            if (inRecovery && !config.isSecondary()) {
                log.warn("Local data store is in recovery, treating {} as secondary (configured role: {})",
                        config.getServerIp(), config.getServerRole().getValue());
            }
            if (!inRecovery && !config.isSecondary()) {
                log.info("Failover monitor not started: not a secondary server (role: {})",
                        config.getServerRole().getValue());
                return false;
            }
            if (!config.isAutoFailoverEnabled()) {
                log.info("Failover monitor not started: auto-failover disabled");
                return false;
            }
            if (config.getMainServerIp() == null || config.getMainServerIp().isBlank()) {
                log.warn("Failover monitor not started: main server address unknown");
                return false;
            }

            guard.recordMainHeartbeat();
            monitorExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread thread = new Thread(r, "failover-monitor");
                thread.setDaemon(true);
                return thread;
            });
            long intervalMillis = settings.getCheckInterval().toMillis();
            monitorTask = monitorExecutor.scheduleWithFixedDelay(
                    this::runCheck, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
            running = true;

            log.info("Failover monitor started: watching main {}:{} every {} (threshold {})",
                    config.getMainServerIp(), config.getMainServerPort(),
                    settings.getCheckInterval(), settings.getFailoverThreshold());
            return true;
        }
    }

    /**
     * Stops monitoring and waits for an in-flight check to finish. Safe to call repeatedly.
     * A failover run already launched is not interrupted.
     */
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            running = false;
            if (monitorTask != null) {
                monitorTask.cancel(false);
                monitorTask = null;
            }
            if (monitorExecutor != null) {
                monitorExecutor.shutdown();
                try {
                    if (!monitorExecutor.awaitTermination(
                            settings.getHealthCheckTimeout().plus(LIFECYCLE_TIMEOUT).toMillis(), TimeUnit.MILLISECONDS)) {
                        monitorExecutor.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    monitorExecutor.shutdownNow();
                }
                monitorExecutor = null;
            }
            log.info("Failover monitor stopped");
        }
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Performs one health check and, if the outage has lasted long enough, launches a failover.
     * Called by the scheduler; exposed so the decision logic can be driven directly.
     */
    public void checkMainServer() {
        ClusterConfig config = configStore.load().block(settings.getReplicationCallTimeout());
        if (config == null || config.getMainServerIp() == null || config.getMainServerIp().isBlank()) {
            return;
        }
        if (config.isMain()) {
            // A stored main whose data store is still replaying WAL is a secondary in fact
            if (!isLocalStoreInRecovery()) {
                log.debug("Skipping health check: this node is main");
                return;
            }
            if (config.getMainServerIp().equals(config.getServerIp())) {
                log.warn("Skipping health check: data store in recovery but main address points to this node");
                return;
            }
        }

        HealthCheckResult result = healthProbe.check(config.getMainServerIp(), config.getMainServerPort())
                .block(settings.getHealthCheckTimeout().plus(LIFECYCLE_TIMEOUT));
        if (result != null && result.isHealthy()) {
            guard.recordMainHeartbeat();
            log.debug("Main server {} healthy", config.getMainServerIp());
            return;
        }

        String reason = result != null ? result.getFailureReason() : "no answer";
        handleMainDown(config, reason);
    }

    private void handleMainDown(ClusterConfig config, String reason) {
        if (guard.isInProgress()) {
            log.debug("Main server down ({}), failover already in progress", reason);
            return;
        }
        Duration outage = guard.timeSinceMainHeartbeat();
        if (guard.tryAcquireIfOutageExceeds(settings.getFailoverThreshold())) {
            log.error("Main server {} down for {}s ({}), initiating failover",
                    config.getMainServerIp(), outage.getSeconds(), reason);
            orchestrator.launch(FailoverTrigger.AUTOMATIC);
        } else {
            log.warn("Main server {} down for {}s ({}), threshold {}s",
                    config.getMainServerIp(), outage.getSeconds(), reason,
                    settings.getFailoverThreshold().getSeconds());
        }
    }

    private void runCheck() {
        if (!running) {
            return;
        }
        try {
            checkMainServer();
        } catch (RuntimeException e) {
            // A thrown exception would cancel the periodic task
            log.error("Health check failed unexpectedly", e);
        }
    }

    private boolean isLocalStoreInRecovery() {
        try {
            return Boolean.TRUE.equals(replicationDriver.isInRecovery()
                    .timeout(settings.getReplicationCallTimeout())
                    .onErrorResume(error -> {
                        log.warn("Could not query recovery state: {}", error.getMessage());
                        return Mono.just(false);
                    })
                    .block());
        } catch (RuntimeException e) {
            log.warn("Could not query recovery state: {}", e.getMessage());
            return false;
        }
    }
}

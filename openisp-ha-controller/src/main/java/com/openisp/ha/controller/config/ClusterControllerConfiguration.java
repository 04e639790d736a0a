package com.openisp.ha.controller.config;

import com.openisp.ha.controller.failover.FailoverGuard;
import com.openisp.ha.controller.failover.FailoverMonitor;
import com.openisp.ha.controller.failover.FailoverOrchestrator;
import com.openisp.ha.controller.failover.ManualFailoverService;
import com.openisp.ha.controller.failover.NotifyRequestHandler;
import com.openisp.ha.controller.failover.PromoteRequestHandler;
import com.openisp.ha.controller.health.IMainHealthProbe;
import com.openisp.ha.controller.health.impl.WebClientHealthProbe;
import com.openisp.ha.controller.membership.ClusterMembershipService;
import com.openisp.ha.controller.membership.LocalNodeIdentity;
import com.openisp.ha.controller.peer.IPeerNotifier;
import com.openisp.ha.controller.peer.impl.WebClientPeerNotifier;
import com.openisp.ha.controller.replication.IReplicationDriver;
import com.openisp.ha.controller.process.CommandRunner;
import com.openisp.ha.controller.replication.impl.InMemoryReplicationDriver;
import com.openisp.ha.controller.replication.impl.PostgresReplicationDriver;
import com.openisp.ha.controller.replication.impl.RedisCliCacheReplicator;
import com.openisp.ha.controller.rest.ClusterAdminController;
import com.openisp.ha.controller.rest.ClusterPeerController;
import com.openisp.ha.controller.service.IDependentServiceController;
import com.openisp.ha.controller.service.impl.DockerServiceController;
import com.openisp.ha.controller.store.IClusterConfigStore;
import com.openisp.ha.controller.store.IClusterEventLog;
import com.openisp.ha.controller.store.IClusterNodeRepository;
import com.openisp.ha.controller.store.impl.InMemoryClusterConfigStore;
import com.openisp.ha.controller.store.impl.InMemoryClusterEventLog;
import com.openisp.ha.controller.store.impl.InMemoryClusterNodeRepository;
import com.openisp.ha.controller.switchover.SwitchoverOrchestrator;
import com.openisp.ha.model.ClusterConfig;
import com.openisp.ha.model.ServerRole;
import lombok.extern.slf4j.Slf4j;
import org.postgresql.ds.PGSimpleDataSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;
import org.springframework.core.env.Environment;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Spring wiring of the failover controller.
 *
 * <p>Settings are read from {@code classpath:openisp-ha.properties}, then from any
 * other property source of the environment. Durations are given in seconds.</p>
 *
 * <h2>Keys</h2>
 * <ul>
 *   <li>{@code openisp.ha.check-interval-seconds}, {@code openisp.ha.failover-threshold-seconds},
 *       {@code openisp.ha.health-check-timeout-seconds}</li>
 *   <li>{@code openisp.ha.peer-port}, {@code openisp.ha.peer-request-timeout-seconds}</li>
 *   <li>{@code openisp.ha.replication-lag-warning-seconds}, {@code openisp.ha.replication-call-timeout-seconds},
 *       {@code openisp.ha.switchover-max-lag-bytes}, {@code openisp.ha.switchover-settle-delay-seconds},
 *       {@code openisp.ha.cache-credential}</li>
 *   <li>{@code openisp.ha.auth-service-name}, {@code openisp.ha.service-restart-timeout-seconds}</li>
 *   <li>{@code openisp.ha.node.*} - the local node's initial cluster config, and the identity
 *       used when creating or joining a cluster</li>
 *   <li>{@code openisp.ha.replication.driver} - {@code postgres} (default) or {@code in-memory}</li>
 *   <li>{@code openisp.ha.db.*} - JDBC url, user, password, replication user and password,
 *       port, container and data directory of the local PostgreSQL</li>
 *   <li>{@code openisp.ha.docker-command}, {@code openisp.ha.cache.cli-command}, {@code openisp.ha.cache.port}</li>
 * </ul>
 *
 * <p>The failover monitor starts with the context and is stopped on close.</p>
 */
@Slf4j
@Configuration
@PropertySource(value = "classpath:openisp-ha.properties", ignoreResourceNotFound = true)
public class ClusterControllerConfiguration {

    static final String PREFIX = "openisp.ha.";
    static final String NODE_PREFIX = PREFIX + "node.";
    static final String DB_PREFIX = PREFIX + "db.";
    static final String DRIVER_POSTGRES = "postgres";
    static final String DRIVER_IN_MEMORY = "in-memory";

    @Bean
    public FailoverSettings failoverSettings(Environment environment) {
        FailoverSettings defaults = FailoverSettings.defaults();
        FailoverSettings settings = FailoverSettings.builder()
                .checkInterval(seconds(environment, "check-interval-seconds", defaults.getCheckInterval()))
                .failoverThreshold(seconds(environment, "failover-threshold-seconds", defaults.getFailoverThreshold()))
                .healthCheckTimeout(seconds(environment, "health-check-timeout-seconds", defaults.getHealthCheckTimeout()))
                .peerRequestTimeout(seconds(environment, "peer-request-timeout-seconds", defaults.getPeerRequestTimeout()))
                .peerPort(environment.getProperty(PREFIX + "peer-port", Integer.class, defaults.getPeerPort()))
                .replicationLagWarning(seconds(environment, "replication-lag-warning-seconds", defaults.getReplicationLagWarning()))
                .replicationCallTimeout(seconds(environment, "replication-call-timeout-seconds", defaults.getReplicationCallTimeout()))
                .switchoverMaxLagBytes(environment.getProperty(PREFIX + "switchover-max-lag-bytes", Long.class,
                        defaults.getSwitchoverMaxLagBytes()))
                .switchoverSettleDelay(seconds(environment, "switchover-settle-delay-seconds", defaults.getSwitchoverSettleDelay()))
                .cacheCredential(environment.getProperty(PREFIX + "cache-credential", defaults.getCacheCredential()))
                .authServiceName(environment.getProperty(PREFIX + "auth-service-name", defaults.getAuthServiceName()))
                .serviceRestartTimeout(seconds(environment, "service-restart-timeout-seconds", defaults.getServiceRestartTimeout()))
                .build();
        settings.validate();
        log.info("Failover controller settings: {}", settings);
        return settings;
    }

    @Bean
    public Clock clusterClock() {
        return Clock.systemUTC();
    }

    // ========== Stores ==========

    @Bean
    public IClusterConfigStore clusterConfigStore(Environment environment, Clock clusterClock) {
        String hardwareId = environment.getProperty(NODE_PREFIX + "hardware-id");
        String serverIp = environment.getProperty(NODE_PREFIX + "server-ip");
        if (hardwareId == null || serverIp == null) {
            log.info("No local cluster config given, starting unconfigured");
            return new InMemoryClusterConfigStore();
        }
        ClusterConfig initial = ClusterConfig.builder()
                .clusterId(environment.getProperty(NODE_PREFIX + "cluster-id"))
                .clusterSecret(environment.getProperty(NODE_PREFIX + "cluster-secret"))
                .hardwareId(hardwareId)
                .serverName(environment.getProperty(NODE_PREFIX + "server-name"))
                .serverIp(serverIp)
                .serverRole(ServerRole.fromValue(environment.getProperty(NODE_PREFIX + "role", "standalone")))
                .mainServerIp(environment.getProperty(NODE_PREFIX + "main-server-ip"))
                .mainServerPort(environment.getProperty(NODE_PREFIX + "main-server-port", Integer.class,
                        ClusterConfig.DEFAULT_MAIN_SERVER_PORT))
                .autoFailoverEnabled(environment.getProperty(NODE_PREFIX + "auto-failover", Boolean.class, true))
                .lastHeartbeat(clusterClock.instant())
                .build();
        log.info("Local cluster config: {}", initial);
        return new InMemoryClusterConfigStore(initial);
    }

    @Bean
    public IClusterNodeRepository clusterNodeRepository() {
        return new InMemoryClusterNodeRepository();
    }

    @Bean
    public IClusterEventLog clusterEventLog() {
        return new InMemoryClusterEventLog();
    }

    // ========== Collaborators ==========

    @Bean
    public LocalNodeIdentity localNodeIdentity(Environment environment) {
        LocalNodeIdentity identity = LocalNodeIdentity.resolve(
                environment.getProperty(NODE_PREFIX + "hardware-id"),
                environment.getProperty(NODE_PREFIX + "server-ip"),
                environment.getProperty(NODE_PREFIX + "server-name"));
        log.info("Local node identity: {}", identity);
        return identity;
    }

    @Bean
    public CommandRunner commandRunner(FailoverSettings failoverSettings) {
        return new CommandRunner(failoverSettings.getServiceRestartTimeout());
    }

    @Bean
    public IReplicationDriver replicationDriver(Environment environment,
                                                IClusterConfigStore clusterConfigStore,
                                                CommandRunner commandRunner) {
        String driver = environment.getProperty(PREFIX + "replication.driver", DRIVER_POSTGRES);
        return switch (driver) {
            case DRIVER_POSTGRES -> postgresDriver(environment, commandRunner);
            case DRIVER_IN_MEMORY -> inMemoryDriver(clusterConfigStore);
            default -> throw new IllegalStateException("Unknown replication driver: " + driver);
        };
    }

    private static IReplicationDriver inMemoryDriver(IClusterConfigStore clusterConfigStore) {
        log.warn("Using the in-memory replication driver, no data store is touched");
        ClusterConfig config = clusterConfigStore.load().block();
        if (config != null && config.isSecondary() && config.getMainServerIp() != null) {
            return InMemoryReplicationDriver.replicaOf(config.getMainServerIp());
        }
        return InMemoryReplicationDriver.primary();
    }

    private static IReplicationDriver postgresDriver(Environment environment, CommandRunner commandRunner) {
        List<String> dockerCommand = words(environment.getProperty(PREFIX + "docker-command", "docker"));
        PostgresReplicationDriver.DataStoreSettings dataStore = PostgresReplicationDriver.DataStoreSettings.builder()
                .port(environment.getProperty(DB_PREFIX + "port", Integer.class, 5432))
                .replicationUser(environment.getProperty(DB_PREFIX + "replication-user", "replicator"))
                .replicationPassword(environment.getProperty(DB_PREFIX + "replication-password", ""))
                .container(environment.getProperty(DB_PREFIX + "container", "openisp-db"))
                .dataDirectory(environment.getProperty(DB_PREFIX + "data-directory", "/var/lib/postgresql/data"))
                .dockerCommand(dockerCommand)
                .build();
        RedisCliCacheReplicator cache = new RedisCliCacheReplicator(
                words(environment.getProperty(PREFIX + "cache.cli-command", "redis-cli")),
                environment.getProperty(PREFIX + "cache.port", Integer.class, 6379),
                commandRunner);
        log.info("Using the PostgreSQL replication driver: {}", dataStore);
        return new PostgresReplicationDriver(dataSource(environment), dataStore, commandRunner, cache,
                Schedulers.boundedElastic());
    }

    private static DataSource dataSource(Environment environment) {
        PGSimpleDataSource dataSource = new PGSimpleDataSource();
        dataSource.setURL(environment.getProperty(DB_PREFIX + "url", "jdbc:postgresql://localhost:5432/postgres"));
        dataSource.setUser(environment.getProperty(DB_PREFIX + "user", "postgres"));
        dataSource.setPassword(environment.getProperty(DB_PREFIX + "password", ""));
        return dataSource;
    }

    @Bean
    public IDependentServiceController dependentServiceController(FailoverSettings failoverSettings) {
        return new DockerServiceController(failoverSettings.getAuthServiceName(), failoverSettings.getServiceRestartTimeout());
    }

    @Bean
    public WebClient clusterWebClient() {
        return WebClient.builder().build();
    }

    @Bean
    public IMainHealthProbe mainHealthProbe(WebClient clusterWebClient, FailoverSettings failoverSettings) {
        return new WebClientHealthProbe(clusterWebClient, failoverSettings.getHealthCheckTimeout());
    }

    @Bean
    public IPeerNotifier peerNotifier(WebClient clusterWebClient, FailoverSettings failoverSettings, Clock clusterClock) {
        return new WebClientPeerNotifier(clusterWebClient, failoverSettings.getPeerPort(),
                failoverSettings.getPeerRequestTimeout(), clusterClock);
    }

    @Bean
    public Scheduler failoverScheduler() {
        return Schedulers.boundedElastic();
    }

    // ========== Failover ==========

    @Bean
    public FailoverGuard failoverGuard(Clock clusterClock) {
        return new FailoverGuard(clusterClock);
    }

    @Bean
    public FailoverOrchestrator failoverOrchestrator(IClusterConfigStore clusterConfigStore,
                                                     IClusterNodeRepository clusterNodeRepository,
                                                     IClusterEventLog clusterEventLog,
                                                     IReplicationDriver replicationDriver,
                                                     IPeerNotifier peerNotifier,
                                                     IDependentServiceController dependentServiceController,
                                                     FailoverGuard failoverGuard,
                                                     FailoverSettings failoverSettings,
                                                     Clock clusterClock,
                                                     Scheduler failoverScheduler) {
        return new FailoverOrchestrator(clusterConfigStore, clusterNodeRepository, clusterEventLog,
                replicationDriver, peerNotifier, dependentServiceController, failoverGuard,
                failoverSettings, clusterClock, failoverScheduler);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public FailoverMonitor failoverMonitor(IClusterConfigStore clusterConfigStore,
                                           IReplicationDriver replicationDriver,
                                           IMainHealthProbe mainHealthProbe,
                                           FailoverOrchestrator failoverOrchestrator,
                                           FailoverSettings failoverSettings) {
        return new FailoverMonitor(clusterConfigStore, replicationDriver, mainHealthProbe,
                failoverOrchestrator, failoverSettings);
    }

    @Bean
    public ManualFailoverService manualFailoverService(IClusterConfigStore clusterConfigStore,
                                                       IClusterNodeRepository clusterNodeRepository,
                                                       IClusterEventLog clusterEventLog,
                                                       IPeerNotifier peerNotifier,
                                                       Clock clusterClock) {
        return new ManualFailoverService(clusterConfigStore, clusterNodeRepository, clusterEventLog, peerNotifier,
                clusterClock);
    }

    @Bean
    public PromoteRequestHandler promoteRequestHandler(IClusterConfigStore clusterConfigStore,
                                                       IClusterEventLog clusterEventLog,
                                                       FailoverOrchestrator failoverOrchestrator,
                                                       Clock clusterClock) {
        return new PromoteRequestHandler(clusterConfigStore, clusterEventLog, failoverOrchestrator, clusterClock);
    }

    @Bean
    public NotifyRequestHandler notifyRequestHandler(IClusterConfigStore clusterConfigStore,
                                                     IClusterEventLog clusterEventLog,
                                                     IReplicationDriver replicationDriver,
                                                     FailoverSettings failoverSettings,
                                                     Clock clusterClock) {
        return new NotifyRequestHandler(clusterConfigStore, clusterEventLog, replicationDriver, failoverSettings,
                clusterClock);
    }

    @Bean
    public SwitchoverOrchestrator switchoverOrchestrator(IClusterConfigStore clusterConfigStore,
                                                         IClusterNodeRepository clusterNodeRepository,
                                                         IClusterEventLog clusterEventLog,
                                                         IReplicationDriver replicationDriver,
                                                         IPeerNotifier peerNotifier,
                                                         FailoverSettings failoverSettings,
                                                         Clock clusterClock) {
        return new SwitchoverOrchestrator(clusterConfigStore, clusterNodeRepository, clusterEventLog,
                replicationDriver, peerNotifier, failoverSettings, clusterClock, Schedulers.parallel());
    }

    @Bean
    public ClusterMembershipService clusterMembershipService(IClusterConfigStore clusterConfigStore,
                                                             IClusterNodeRepository clusterNodeRepository,
                                                             IClusterEventLog clusterEventLog,
                                                             IReplicationDriver replicationDriver,
                                                             IPeerNotifier peerNotifier,
                                                             FailoverMonitor failoverMonitor,
                                                             LocalNodeIdentity localNodeIdentity,
                                                             FailoverSettings failoverSettings,
                                                             Clock clusterClock) {
        return new ClusterMembershipService(clusterConfigStore, clusterNodeRepository, clusterEventLog,
                replicationDriver, peerNotifier, failoverMonitor, localNodeIdentity, failoverSettings, clusterClock);
    }

    // ========== Controllers ==========

    @Bean
    public ClusterPeerController clusterPeerController(IClusterConfigStore clusterConfigStore,
                                                       NotifyRequestHandler notifyRequestHandler,
                                                       PromoteRequestHandler promoteRequestHandler,
                                                       ClusterMembershipService clusterMembershipService) {
        return new ClusterPeerController(clusterConfigStore, notifyRequestHandler, promoteRequestHandler,
                clusterMembershipService);
    }

    @Bean
    public ClusterAdminController clusterAdminController(ManualFailoverService manualFailoverService,
                                                         SwitchoverOrchestrator switchoverOrchestrator,
                                                         ClusterMembershipService clusterMembershipService) {
        return new ClusterAdminController(manualFailoverService, switchoverOrchestrator, clusterMembershipService);
    }

    private static List<String> words(String command) {
        return Arrays.asList(command.trim().split("\\s+"));
    }

    private static Duration seconds(Environment environment, String key, Duration defaultValue) {
        Long value = environment.getProperty(PREFIX + key, Long.class);
        return value != null ? Duration.ofSeconds(value) : defaultValue;
    }
}

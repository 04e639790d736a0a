package com.openisp.ha.controller.replication.impl;

import com.openisp.ha.controller.process.CommandRunner;
import com.openisp.ha.controller.replication.IReplicationDriver;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Replication driver for a PostgreSQL streaming-replication pair and a Redis cache.
 *
 * <ul>
 *   <li>recovery state - {@code pg_is_in_recovery()}</li>
 *   <li>promotion - {@code pg_promote()}, then writes are re-enabled</li>
 *   <li>fencing - {@code ALTER SYSTEM SET default_transaction_read_only} and {@code pg_reload_conf()}</li>
 *   <li>lag - {@code pg_last_xact_replay_timestamp()} on a replica, {@code pg_stat_replication} on a primary</li>
 *   <li>demotion - {@code primary_conninfo} and {@code primary_slot_name}, a {@code standby.signal}
 *       file in the data directory and a restart of the database container</li>
 *   <li>cache - delegated to {@link RedisCliCacheReplicator}</li>
 * </ul>
 *
 * JDBC and process calls block, so every operation runs on the given worker scheduler.
 * {@code ALTER SYSTEM} cannot run in a transaction block; connections are used in auto-commit mode.
 */
@Slf4j
public class PostgresReplicationDriver implements IReplicationDriver {

    static final String IN_RECOVERY_SQL = "SELECT pg_is_in_recovery()";
    static final String PROMOTE_SQL = "SELECT pg_promote()";
    static final String RELOAD_SQL = "SELECT pg_reload_conf()";
    static final String REPLAY_LAG_SQL =
            "SELECT COALESCE(EXTRACT(EPOCH FROM (now() - pg_last_xact_replay_timestamp())), 0)::bigint";
    static final String SENDER_LAG_SQL =
            "SELECT pg_wal_lsn_diff(sent_lsn, replay_lsn)::bigint FROM pg_stat_replication WHERE client_addr = ?::inet";
    static final String ENSURE_SLOT_SQL =
            "SELECT pg_create_physical_replication_slot(?) "
                    + "WHERE NOT EXISTS (SELECT 1 FROM pg_replication_slots WHERE slot_name = ?)";

    private final DataSource dataSource;
    private final DataStoreSettings dataStore;
    private final CommandRunner commandRunner;
    private final RedisCliCacheReplicator cache;
    private final Scheduler scheduler;

    public PostgresReplicationDriver(DataSource dataSource,
                                     DataStoreSettings dataStore,
                                     CommandRunner commandRunner,
                                     RedisCliCacheReplicator cache,
                                     Scheduler scheduler) {
        this.dataSource = Objects.requireNonNull(dataSource);
        this.dataStore = Objects.requireNonNull(dataStore);
        this.commandRunner = Objects.requireNonNull(commandRunner);
        this.cache = Objects.requireNonNull(cache);
        this.scheduler = Objects.requireNonNull(scheduler);
    }

    /**
     * Where the local database lives and how a replica reaches its primary.
     */
    @Getter
    @Builder
    @ToString(exclude = "replicationPassword")
    public static final class DataStoreSettings {

        @Builder.Default
        private final int port = 5432;

        @Builder.Default
        private final String replicationUser = "replicator";

        @Builder.Default
        private final String replicationPassword = "";

        @Builder.Default
        private final String container = "openisp-db";

        @Builder.Default
        private final String dataDirectory = "/var/lib/postgresql/data";

        @Builder.Default
        private final List<String> dockerCommand = List.of("docker");
    }

    @Override
    public Mono<Boolean> isInRecovery() {
        return query(() -> queryBoolean(IN_RECOVERY_SQL));
    }

    @Override
    public Mono<Void> promoteToMain() {
        return run(() -> {
            if (!queryBoolean(IN_RECOVERY_SQL)) {
                log.info("Data store is already a primary, nothing to promote");
            } else if (!queryBoolean(PROMOTE_SQL)) {
                throw new IllegalStateException("pg_promote() returned false");
            } else {
                log.info("Data store promoted to primary");
            }
            // A fence left from an earlier switchover would keep the new primary read-only
            applyReadOnly(false);
        });
    }

    @Override
    public Mono<Void> demoteToReplica(String newPrimaryHost, String slotName) {
        return run(() -> {
            try (Connection connection = dataSource.getConnection();
                 Statement statement = connection.createStatement()) {
                statement.execute("ALTER SYSTEM SET primary_conninfo = " + literal(conninfo(newPrimaryHost, slotName)));
                statement.execute("ALTER SYSTEM SET primary_slot_name = " + literal(slotName));
                statement.execute("ALTER SYSTEM RESET default_transaction_read_only");
            } catch (SQLException e) {
                throw new IllegalStateException("Could not configure replication from " + newPrimaryHost
                        + ": " + e.getMessage(), e);
            }
            commandRunner.run("Creating standby.signal in " + dataStore.getContainer(),
                    docker("exec", dataStore.getContainer(), "touch", dataStore.getDataDirectory() + "/standby.signal"));
            commandRunner.run("Restart of " + dataStore.getContainer(),
                    docker("restart", dataStore.getContainer()));
            log.info("Data store now replicating from {} using slot {}", newPrimaryHost, slotName);
        });
    }

    @Override
    public Mono<Long> replicationLagSeconds() {
        return query(() -> queryLong(REPLAY_LAG_SQL));
    }

    @Override
    public Mono<Long> replicationLagBytes(String replicaHost) {
        return query(() -> {
            try (Connection connection = dataSource.getConnection();
                 PreparedStatement statement = connection.prepareStatement(SENDER_LAG_SQL)) {
                statement.setString(1, replicaHost);
                try (ResultSet rows = statement.executeQuery()) {
                    if (!rows.next()) {
                        throw new IllegalStateException("replica " + replicaHost + " is not streaming from this server");
                    }
                    return rows.getLong(1);
                }
            }
        });
    }

    @Override
    public Mono<Void> setWritesFenced(boolean fenced) {
        return run(() -> {
            applyReadOnly(fenced);
            log.info("Data store writes {}", fenced ? "fenced (read-only)" : "re-enabled");
        });
    }

    @Override
    public Mono<Void> stopCacheReplication(String credential) {
        return run(() -> cache.detach(credential));
    }

    @Override
    public Mono<Void> followCache(String mainHost, String credential) {
        return run(() -> cache.follow(mainHost, credential));
    }

    @Override
    public Mono<Void> ensureReplicationSlot(String slotName) {
        return run(() -> {
            try (Connection connection = dataSource.getConnection();
                 PreparedStatement statement = connection.prepareStatement(ENSURE_SLOT_SQL)) {
                statement.setString(1, slotName);
                statement.setString(2, slotName);
                statement.execute();
            } catch (SQLException e) {
                throw new IllegalStateException("Could not create replication slot " + slotName + ": " + e.getMessage(), e);
            }
            log.info("Replication slot {} reserved", slotName);
        });
    }

    // ========== JDBC helpers ==========

    private void applyReadOnly(boolean readOnly) {
        try (Connection connection = dataSource.getConnection();
             Statement statement = connection.createStatement()) {
            statement.execute("ALTER SYSTEM SET default_transaction_read_only = " + (readOnly ? "on" : "off"));
            statement.execute(RELOAD_SQL);
        } catch (SQLException e) {
            throw new IllegalStateException("Could not " + (readOnly ? "fence" : "unfence") + " writes: "
                    + e.getMessage(), e);
        }
    }

    private boolean queryBoolean(String sql) {
        try (Connection connection = dataSource.getConnection();
             Statement statement = connection.createStatement();
             ResultSet rows = statement.executeQuery(sql)) {
            return rows.next() && rows.getBoolean(1);
        } catch (SQLException e) {
            throw new IllegalStateException(sql + " failed: " + e.getMessage(), e);
        }
    }

    private long queryLong(String sql) throws SQLException {
        try (Connection connection = dataSource.getConnection();
             Statement statement = connection.createStatement();
             ResultSet rows = statement.executeQuery(sql)) {
            return rows.next() ? rows.getLong(1) : 0L;
        }
    }

    String conninfo(String host, String slotName) {
        return "host=" + conninfoValue(host)
                + " port=" + dataStore.getPort()
                + " user=" + conninfoValue(dataStore.getReplicationUser())
                + " password=" + conninfoValue(dataStore.getReplicationPassword())
                + " application_name=" + conninfoValue(slotName);
    }

    /**
     * Quotes a libpq connection-string value.
     */
    static String conninfoValue(String value) {
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    /**
     * Quotes an SQL string literal; ALTER SYSTEM takes no bind parameters.
     */
    static String literal(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    private List<String> docker(String... arguments) {
        List<String> command = new ArrayList<>(dataStore.getDockerCommand());
        command.addAll(List.of(arguments));
        return command;
    }

    // ========== Scheduling ==========

    @FunctionalInterface
    interface SqlCallable<T> {
        T call() throws SQLException;
    }

    private <T> Mono<T> query(SqlCallable<T> work) {
        return Mono.fromCallable(() -> {
            try {
                return work.call();
            } catch (SQLException e) {
                throw new IllegalStateException(e.getMessage(), e);
            }
        }).subscribeOn(scheduler);
    }

    private Mono<Void> run(Runnable work) {
        return Mono.<Void>fromRunnable(work).subscribeOn(scheduler);
    }
}

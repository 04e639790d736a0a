package com.openisp.ha.controller.replication.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.sql.SQLException;
import java.util.List;

import static com.openisp.ha.controller.replication.impl.PostgresReplicationDriver.*;
import static org.junit.jupiter.api.Assertions.*;

class PostgresReplicationDriverTest {

    private static final String READ_ONLY_ON = "ALTER SYSTEM SET default_transaction_read_only = on";
    private static final String READ_ONLY_OFF = "ALTER SYSTEM SET default_transaction_read_only = off";

    private ScriptedDataSource database;
    private RecordingCommandRunner commands;
    private PostgresReplicationDriver driver;

    @BeforeEach
    void setUp() {
        database = new ScriptedDataSource();
        commands = new RecordingCommandRunner();
        driver = driverWith(DataStoreSettings.builder().build());
    }

    private PostgresReplicationDriver driverWith(DataStoreSettings settings) {
        RedisCliCacheReplicator cache = new RedisCliCacheReplicator(List.of("redis-cli"), 6379, commands);
        return new PostgresReplicationDriver(database.dataSource(), settings, commands, cache, Schedulers.immediate());
    }

    @Nested
    @DisplayName("Promotion")
    class Promotion {

        @Test
        @DisplayName("should promote a replica and re-enable writes")
        void shouldPromoteReplica() {
            // Given
            database.answer(IN_RECOVERY_SQL, true).answer(PROMOTE_SQL, true);

            // When
            StepVerifier.create(driver.promoteToMain()).verifyComplete();

            // Then
            assertEquals(List.of(IN_RECOVERY_SQL, PROMOTE_SQL, READ_ONLY_OFF, RELOAD_SQL), database.getStatements());
        }

        @Test
        @DisplayName("should only re-enable writes on a primary")
        void shouldSkipPromotionOnPrimary() {
            database.answer(IN_RECOVERY_SQL, false);

            StepVerifier.create(driver.promoteToMain()).verifyComplete();

            assertFalse(database.getStatements().contains(PROMOTE_SQL));
            assertTrue(database.getStatements().contains(READ_ONLY_OFF));
        }

        @Test
        @DisplayName("should fail when the server declines to promote")
        void shouldFailWhenPromotionDeclined() {
            database.answer(IN_RECOVERY_SQL, true).answer(PROMOTE_SQL, false);

            StepVerifier.create(driver.promoteToMain())
                    .expectErrorMessage("pg_promote() returned false")
                    .verify();

            assertFalse(database.getStatements().contains(READ_ONLY_OFF));
        }
    }

    @Nested
    @DisplayName("Queries")
    class Queries {

        @Test
        @DisplayName("should report the recovery state")
        void shouldReportRecovery() {
            database.answer(IN_RECOVERY_SQL, true);

            StepVerifier.create(driver.isInRecovery()).expectNext(true).verifyComplete();
        }

        @Test
        @DisplayName("should report replay lag in seconds")
        void shouldReportReplayLag() {
            database.answer(REPLAY_LAG_SQL, 12L);

            StepVerifier.create(driver.replicationLagSeconds()).expectNext(12L).verifyComplete();
        }

        @Test
        @DisplayName("should report the byte lag of a streaming replica")
        void shouldReportSenderLag() {
            database.answer(SENDER_LAG_SQL, 4096L);

            StepVerifier.create(driver.replicationLagBytes("10.0.0.2")).expectNext(4096L).verifyComplete();

            assertEquals(List.of(SENDER_LAG_SQL + " [10.0.0.2]"), database.getStatements());
        }

        @Test
        @DisplayName("should fail for a replica that is not streaming")
        void shouldFailForUnknownReplica() {
            StepVerifier.create(driver.replicationLagBytes("10.0.0.9"))
                    .expectErrorMessage("replica 10.0.0.9 is not streaming from this server")
                    .verify();
        }

        @Test
        @DisplayName("should signal an unreachable database as an error")
        void shouldSignalConnectionFailure() {
            database.failConnectionsWith(new SQLException("connection refused"));

            StepVerifier.create(driver.isInRecovery())
                    .expectErrorSatisfies(error -> {
                        assertInstanceOf(IllegalStateException.class, error);
                        assertTrue(error.getMessage().contains("connection refused"));
                    })
                    .verify();
        }
    }

    @Nested
    @DisplayName("Fencing and slots")
    class FencingAndSlots {

        @Test
        @DisplayName("should switch the default transaction mode and reload")
        void shouldFenceAndUnfence() {
            StepVerifier.create(driver.setWritesFenced(true).then(driver.setWritesFenced(false))).verifyComplete();

            assertEquals(List.of(READ_ONLY_ON, RELOAD_SQL, READ_ONLY_OFF, RELOAD_SQL), database.getStatements());
        }

        @Test
        @DisplayName("should create the slot only if it does not exist")
        void shouldEnsureSlot() {
            StepVerifier.create(driver.ensureReplicationSlot("replica_0242ac110009")).verifyComplete();

            assertEquals(List.of(ENSURE_SLOT_SQL + " [replica_0242ac110009, replica_0242ac110009]"),
                    database.getStatements());
        }
    }

    @Nested
    @DisplayName("Demotion")
    class Demotion {

        @Test
        @DisplayName("should point the data store at the new primary and restart it as a standby")
        void shouldDemote() {
            // Given
            PostgresReplicationDriver custom = driverWith(DataStoreSettings.builder()
                    .replicationPassword("pa'ss")
                    .container("db")
                    .dataDirectory("/data")
                    .build());

            // When
            StepVerifier.create(custom.demoteToReplica("10.0.0.1", "replica_abc")).verifyComplete();

            // Then
            assertEquals(List.of(
                    "ALTER SYSTEM SET primary_conninfo = 'host=''10.0.0.1'' port=5432 user=''replicator'' "
                            + "password=''pa\\''ss'' application_name=''replica_abc'''",
                    "ALTER SYSTEM SET primary_slot_name = 'replica_abc'",
                    "ALTER SYSTEM RESET default_transaction_read_only"), database.getStatements());
            assertEquals(List.of(
                    List.of("docker", "exec", "db", "touch", "/data/standby.signal"),
                    List.of("docker", "restart", "db")), commands.getCommands());
        }

        @Test
        @DisplayName("should not restart the data store when it cannot be reconfigured")
        void shouldStopOnSqlFailure() {
            database.failConnectionsWith(new SQLException("read-only file system"));

            StepVerifier.create(driver.demoteToReplica("10.0.0.1", "replica_abc"))
                    .expectErrorSatisfies(error -> assertTrue(error.getMessage()
                            .startsWith("Could not configure replication from 10.0.0.1")))
                    .verify();

            assertTrue(commands.getCommands().isEmpty());
        }
    }

    @Test
    @DisplayName("should quote values for SQL and libpq")
    void shouldQuoteValues() {
        assertEquals("'it''s'", literal("it's"));
        assertEquals("'a\\\\b\\'c'", conninfoValue("a\\b'c"));
    }

    @Test
    @DisplayName("should hand cache commands to redis-cli")
    void shouldDriveCache() {
        StepVerifier.create(driver.followCache("10.0.0.1", "").then(driver.stopCacheReplication(""))).verifyComplete();

        assertEquals(List.of(
                List.of("redis-cli", "REPLICAOF", "10.0.0.1", "6379"),
                List.of("redis-cli", "REPLICAOF", "NO", "ONE")), commands.getCommands());
    }
}

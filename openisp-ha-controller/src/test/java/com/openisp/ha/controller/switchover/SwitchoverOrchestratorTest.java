package com.openisp.ha.controller.switchover;

import com.openisp.ha.controller.exception.ClusterConfigurationException;
import com.openisp.ha.controller.exception.FailoverPipelineException;
import com.openisp.ha.controller.replication.impl.InMemoryReplicationDriver;
import com.openisp.ha.controller.support.ClusterFixture;
import com.openisp.ha.model.ApiRole;
import com.openisp.ha.model.ClusterConfig;
import com.openisp.ha.model.ClusterEventType;
import com.openisp.ha.model.RadiusRole;
import com.openisp.ha.model.ServerRole;
import com.openisp.ha.model.peer.PeerEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.util.List;

import static com.openisp.ha.controller.support.ClusterFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class SwitchoverOrchestratorTest {

    private static final String EXPECTED_SLOT = "replica_" + MAIN_HW.substring(0, 16);

    private ClusterFixture cluster;
    private SwitchoverOrchestrator switchover;

    @BeforeEach
    void setUp() {
        cluster = ClusterFixture.onMain();
        switchover = orchestratorFor(cluster);
    }

    private static SwitchoverOrchestrator orchestratorFor(ClusterFixture cluster) {
        return new SwitchoverOrchestrator(cluster.configStore, cluster.nodeRepository, cluster.eventLog,
                cluster.replicationDriver, cluster.peerNotifier, cluster.settings, cluster.clock,
                Schedulers.parallel());
    }

    @Nested
    @DisplayName("Planned switchover")
    class PlannedSwitchover {

        @Test
        @DisplayName("should fence, hand over, then demote to a replica of the target")
        void shouldHandOver() {
            // When
            StepVerifier.create(switchover.switchoverTo(cluster.secondaryNode.getId()))
                    .assertNext(result -> {
                        assertEquals(MAIN_IP, result.getFormerMainIp());
                        assertEquals(SECONDARY_IP, result.getNewMainIp());
                        assertEquals(EXPECTED_SLOT, result.getReplicationSlot());
                    })
                    .verifyComplete();

            // Then
            assertEquals(List.of("lag-bytes:" + SECONDARY_IP, "fence", "demote:" + SECONDARY_IP + ":" + EXPECTED_SLOT),
                    cluster.replicationDriver.getJournal());
            assertEquals(InMemoryReplicationDriver.StoreRole.REPLICA, cluster.replicationDriver.getStoreRole());
            assertEquals(PeerEvent.SWITCHOVER, cluster.peerNotifier.getPromotionRequests().get(0).getEvent());
            assertEquals(MAIN_IP, cluster.peerNotifier.getPromotionRequests().get(0).getCurrentMain());
        }

        @Test
        @DisplayName("should persist the secondary config")
        void shouldPersistSecondaryConfig() {
            switchover.switchoverTo(cluster.secondaryNode.getId()).block();

            ClusterConfig config = cluster.config();
            assertEquals(ServerRole.SECONDARY, config.getServerRole());
            assertEquals(ApiRole.STANDBY, config.getApiRole());
            assertEquals(RadiusRole.BACKUP, config.getRadiusRole());
            assertEquals(SECONDARY_IP, config.getMainServerIp());
            assertEquals(ServerRole.SECONDARY, cluster.rosterRow(cluster.mainNode.getId()).getServerRole());
            assertEquals(List.of(ClusterEventType.SWITCHOVER_STARTED, ClusterEventType.SWITCHOVER_COMPLETED),
                    cluster.eventTypes());
        }

        @Test
        @DisplayName("should accept lag exactly at the limit")
        void shouldAcceptLagAtLimit() {
            cluster.replicationDriver.setLagBytes(SECONDARY_IP, cluster.settings.getSwitchoverMaxLagBytes());

            StepVerifier.create(switchover.switchoverTo(cluster.secondaryNode.getId()))
                    .expectNextCount(1)
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Rejections")
    class Rejections {

        @Test
        @DisplayName("should refuse when the target lags by more than a megabyte, before fencing")
        void shouldRefuseHighLag() {
            cluster.replicationDriver.setLagBytes(SECONDARY_IP, 2L * 1024 * 1024);

            StepVerifier.create(switchover.switchoverTo(cluster.secondaryNode.getId()))
                    .expectErrorSatisfies(error -> {
                        assertInstanceOf(ClusterConfigurationException.class, error);
                        assertEquals("replication lag too high (2097152 bytes), wait for sync", error.getMessage());
                    })
                    .verify();

            assertEquals(List.of("lag-bytes:" + SECONDARY_IP), cluster.replicationDriver.getJournal());
            assertFalse(cluster.replicationDriver.isWritesFenced());
            assertTrue(cluster.peerNotifier.getPromotionRequests().isEmpty());
            assertTrue(cluster.events().isEmpty());
        }

        @Test
        @DisplayName("should refuse on a secondary")
        void shouldRefuseOnSecondary() {
            ClusterFixture onSecondary = ClusterFixture.onSecondary();

            StepVerifier.create(orchestratorFor(onSecondary).switchoverTo(onSecondary.thirdNode.getId()))
                    .expectErrorMessage("can only initiate switchover from main server")
                    .verify();

            assertTrue(onSecondary.replicationDriver.getJournal().isEmpty());
        }

        @Test
        @DisplayName("should refuse an unknown target")
        void shouldRefuseUnknownTarget() {
            StepVerifier.create(switchover.switchoverTo(42L))
                    .expectErrorMessage("secondary node not found")
                    .verify();

            assertTrue(cluster.replicationDriver.getJournal().isEmpty());
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("should unfence and stay main when the target cannot be reached")
        void shouldUnfenceWhenTargetUnreachable() {
            cluster.peerNotifier.makeUnreachable(SECONDARY_IP);

            StepVerifier.create(switchover.switchoverTo(cluster.secondaryNode.getId()))
                    .expectErrorSatisfies(error -> {
                        assertInstanceOf(FailoverPipelineException.class, error);
                        assertTrue(error.getMessage().startsWith("failed to contact secondary: "));
                    })
                    .verify();

            assertEquals(List.of("lag-bytes:" + SECONDARY_IP, "fence", "unfence"),
                    cluster.replicationDriver.getJournal());
            assertFalse(cluster.replicationDriver.isWritesFenced());
            assertEquals(ServerRole.MAIN, cluster.config().getServerRole());
            assertEquals(List.of(ClusterEventType.SWITCHOVER_STARTED, ClusterEventType.SWITCHOVER_FAILED),
                    cluster.eventTypes());
        }

        @Test
        @DisplayName("should treat a non-200 answer as a failed hand-over")
        void shouldUnfenceOnRejectedRequest() {
            cluster.peerNotifier.answerPromotionsWith(400);

            StepVerifier.create(switchover.switchoverTo(cluster.secondaryNode.getId()))
                    .expectError(FailoverPipelineException.class)
                    .verify();

            assertFalse(cluster.replicationDriver.isWritesFenced());
            assertEquals(ServerRole.MAIN, cluster.config().getServerRole());
        }

        @Test
        @DisplayName("should follow the new main in config even when demotion fails")
        void shouldPersistConfigWhenDemotionFails() {
            cluster.replicationDriver.failDemotionWith(new IllegalStateException("pg_rewind failed"));

            StepVerifier.create(switchover.switchoverTo(cluster.secondaryNode.getId()))
                    .expectErrorSatisfies(error -> {
                        assertInstanceOf(FailoverPipelineException.class, error);
                        assertTrue(error.getMessage().contains("pg_rewind failed"));
                    })
                    .verify();

            assertEquals(ServerRole.SECONDARY, cluster.config().getServerRole());
            assertEquals(SECONDARY_IP, cluster.config().getMainServerIp());
            assertEquals(List.of(ClusterEventType.SWITCHOVER_STARTED, ClusterEventType.SWITCHOVER_FAILED),
                    cluster.eventTypes());
        }
    }

    @Test
    @DisplayName("should derive the slot name from the first sixteen characters of the hardware id")
    void shouldDeriveSlotName() {
        assertEquals("replica_a1b2c3d4e5f60718", SwitchoverOrchestrator.slotNameFor(MAIN_HW));
        assertEquals("replica_short", SwitchoverOrchestrator.slotNameFor("short"));
    }
}

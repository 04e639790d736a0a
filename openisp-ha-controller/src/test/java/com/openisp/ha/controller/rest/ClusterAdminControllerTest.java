package com.openisp.ha.controller.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openisp.ha.controller.failover.FailoverMonitor;
import com.openisp.ha.controller.failover.ManualFailoverService;
import com.openisp.ha.controller.support.ClusterFixture;
import com.openisp.ha.controller.switchover.SwitchoverOrchestrator;
import com.openisp.ha.model.NodeStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.scheduler.Schedulers;

import static com.openisp.ha.controller.support.ClusterFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class ClusterAdminControllerTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private static WebTestClient clientFor(ClusterFixture cluster) {
        FailoverMonitor monitor = cluster.monitor(cluster.orchestrator());
        ClusterAdminController controller = new ClusterAdminController(
                new ManualFailoverService(cluster.configStore, cluster.nodeRepository, cluster.eventLog,
                        cluster.peerNotifier, cluster.clock),
                new SwitchoverOrchestrator(cluster.configStore, cluster.nodeRepository, cluster.eventLog,
                        cluster.replicationDriver, cluster.peerNotifier, cluster.settings, cluster.clock, Schedulers.parallel()),
                cluster.membership(monitor, ClusterFixture.newServerIdentity()));
        return WebTestClient.bindToController(controller).build();
    }

    private JsonNode read(WebTestClient.ResponseSpec response, int expectedStatus) throws Exception {
        byte[] body = response.expectStatus().isEqualTo(expectedStatus)
                .expectBody().returnResult().getResponseBody();
        return mapper.readTree(body);
    }

    private static WebTestClient.ResponseSpec postTarget(WebTestClient client, String path, String json) {
        return client.post().uri("/api/v1/cluster" + path)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(json)
                .exchange();
    }

    @Nested
    @DisplayName("Manual failover")
    class ManualFailover {

        @Test
        @DisplayName("should return the target once it accepted")
        void shouldInitiateFailover() throws Exception {
            ClusterFixture cluster = ClusterFixture.onMain();

            JsonNode json = read(postTarget(clientFor(cluster), "/failover",
                    "{\"target_node_id\":" + cluster.secondaryNode.getId() + "}"), 200);

            assertTrue(json.get("success").asBoolean());
            assertEquals(SECONDARY_IP, json.get("data").get("serverIp").asText());
        }

        @Test
        @DisplayName("should answer 400 on a secondary")
        void shouldRejectOnSecondary() throws Exception {
            ClusterFixture cluster = ClusterFixture.onSecondary();

            JsonNode json = read(postTarget(clientFor(cluster), "/failover",
                    "{\"target_node_id\":" + cluster.thirdNode.getId() + "}"), 400);

            assertEquals("CONFIGURATION", json.get("errorCode").asText());
            assertEquals("can only initiate failover from main server", json.get("error").asText());
            assertTrue(cluster.peerNotifier.getPromotionRequests().isEmpty());
        }

        @Test
        @DisplayName("should answer 400 when the target is missing from the body")
        void shouldRequireTarget() throws Exception {
            JsonNode json = read(postTarget(clientFor(ClusterFixture.onMain()), "/failover", "{}"), 400);

            assertEquals("target_node_id is required", json.get("error").asText());
        }

        @Test
        @DisplayName("should answer 502 when the target refuses")
        void shouldReportPeerFailure() throws Exception {
            ClusterFixture cluster = ClusterFixture.onMain();
            cluster.peerNotifier.answerPromotionsWith(500);

            JsonNode json = read(postTarget(clientFor(cluster), "/failover",
                    "{\"target_node_id\":" + cluster.secondaryNode.getId() + "}"), 502);

            assertEquals("PEER", json.get("errorCode").asText());
        }
    }

    @Nested
    @DisplayName("Switchover")
    class Switchover {

        @Test
        @DisplayName("should hand over to the target")
        void shouldSwitchOver() throws Exception {
            ClusterFixture cluster = ClusterFixture.onMain();

            JsonNode json = read(postTarget(clientFor(cluster), "/switchover",
                    "{\"target_node_id\":" + cluster.secondaryNode.getId() + "}"), 200);

            assertEquals(SECONDARY_IP, json.get("data").get("newMainIp").asText());
        }

        @Test
        @DisplayName("should answer 400 when the target lags too far behind")
        void shouldRejectHighLag() throws Exception {
            ClusterFixture cluster = ClusterFixture.onMain();
            cluster.replicationDriver.setLagBytes(SECONDARY_IP, 5_000_000L);

            JsonNode json = read(postTarget(clientFor(cluster), "/switchover",
                    "{\"target_node_id\":" + cluster.secondaryNode.getId() + "}"), 400);

            assertEquals("replication lag too high (5000000 bytes), wait for sync", json.get("error").asText());
        }

        @Test
        @DisplayName("should answer 502 when the hand-over fails")
        void shouldReportPipelineFailure() throws Exception {
            ClusterFixture cluster = ClusterFixture.onMain();
            cluster.peerNotifier.makeUnreachable(SECONDARY_IP);

            JsonNode json = read(postTarget(clientFor(cluster), "/switchover",
                    "{\"target_node_id\":" + cluster.secondaryNode.getId() + "}"), 502);

            assertEquals("FATAL_PIPELINE", json.get("errorCode").asText());
        }
    }

    @Nested
    @DisplayName("Membership")
    class Membership {

        @Test
        @DisplayName("should report the cluster status")
        void shouldReportStatus() throws Exception {
            ClusterFixture cluster = ClusterFixture.onMain();
            cluster.nodeRepository.updateStatusByServerIp(THIRD_IP, NodeStatus.OFFLINE).block();

            JsonNode json = read(clientFor(cluster).get().uri("/api/v1/cluster/status").exchange(), 200);

            JsonNode data = json.get("data");
            assertEquals(CLUSTER_ID, data.get("clusterId").asText());
            assertEquals("main", data.get("serverRole").asText());
            assertEquals(3, data.get("totalNodes").asInt());
            assertEquals(2, data.get("onlineNodes").asInt());
        }

        @Test
        @DisplayName("should remove a node")
        void shouldRemoveNode() throws Exception {
            ClusterFixture cluster = ClusterFixture.onMain();

            read(clientFor(cluster).delete().uri("/api/v1/cluster/nodes/" + cluster.thirdNode.getId()).exchange(), 200);

            assertTrue(cluster.nodeRepository.findById(cluster.thirdNode.getId()).block().isEmpty());
        }

        @Test
        @DisplayName("should create a cluster and return its credentials")
        void shouldSetupMain() throws Exception {
            ClusterFixture cluster = ClusterFixture.unconfigured();

            JsonNode json = read(postTarget(clientFor(cluster), "/setup-main",
                    "{\"server_name\":\"panel-a\",\"server_ip\":\"192.168.1.10\"}"), 200);

            JsonNode data = json.get("data");
            assertTrue(data.get("clusterId").asText().startsWith("CL-"));
            assertEquals(cluster.config().getClusterSecret(), data.get("clusterSecret").asText());
            assertEquals("192.168.1.10", data.get("serverIp").asText());
            assertEquals("panel-a", cluster.config().getServerName());
        }

        @Test
        @DisplayName("should answer 400 to setup-main on a clustered server")
        void shouldRejectSetupMainWhenClustered() throws Exception {
            JsonNode json = read(postTarget(clientFor(ClusterFixture.onMain()), "/setup-main", "{}"), 400);

            assertEquals("already part of cluster " + CLUSTER_ID + " - leave it first", json.get("error").asText());
        }

        @Test
        @DisplayName("should answer 400 to setup-secondary without a secret")
        void shouldRequireSecretForSetupSecondary() throws Exception {
            ClusterFixture cluster = ClusterFixture.unconfigured();

            JsonNode json = read(postTarget(clientFor(cluster), "/setup-secondary",
                    "{\"main_server_ip\":\"" + MAIN_IP + "\"}"), 400);

            assertEquals("main_server_ip and cluster_secret are required", json.get("error").asText());
            assertTrue(cluster.peerNotifier.getJoinRequests().isEmpty());
        }

        @Test
        @DisplayName("should answer 502 when the main refuses to admit this server")
        void shouldReportJoinRefusal() throws Exception {
            ClusterFixture cluster = ClusterFixture.unconfigured();
            cluster.peerNotifier.refuseJoinsWith("invalid cluster secret");

            JsonNode json = read(postTarget(clientFor(cluster), "/setup-secondary",
                    "{\"main_server_ip\":\"" + MAIN_IP + "\",\"cluster_secret\":\"wrong\"}"), 502);

            assertEquals("PEER", json.get("errorCode").asText());
            assertEquals("invalid cluster secret", json.get("error").asText());
            assertNull(cluster.config());
        }

        @Test
        @DisplayName("should refuse to let the main leave while members remain")
        void shouldRefuseLeave() throws Exception {
            JsonNode json = read(clientFor(ClusterFixture.onMain()).post().uri("/api/v1/cluster/leave").exchange(), 400);

            assertFalse(json.get("success").asBoolean());
        }
    }
}

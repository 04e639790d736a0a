package com.openisp.ha.controller.failover;

import com.openisp.ha.controller.exception.ClusterAuthenticationException;
import com.openisp.ha.controller.exception.ClusterConfigurationException;
import com.openisp.ha.controller.store.IClusterEventLog;
import com.openisp.ha.controller.store.impl.InMemoryClusterEventLog;
import com.openisp.ha.controller.support.ClusterFixture;
import com.openisp.ha.model.ClusterEvent;
import com.openisp.ha.model.ClusterEventType;
import com.openisp.ha.model.EventSeverity;
import com.openisp.ha.model.ServerRole;
import com.openisp.ha.model.peer.PeerEvent;
import com.openisp.ha.model.peer.PromoteRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static com.openisp.ha.controller.support.ClusterFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class PromoteRequestHandlerTest {

    private static PromoteRequest request(PeerEvent event, String secret) {
        return PromoteRequest.of(event, MAIN_IP, CLUSTER_ID, secret);
    }

    private static PromoteRequestHandler handlerFor(ClusterFixture cluster, FailoverOrchestrator orchestrator) {
        return new PromoteRequestHandler(cluster.configStore, cluster.eventLog, orchestrator, cluster.clock);
    }

    @Test
    @DisplayName("should acknowledge and run the failover pipeline")
    void shouldRunFailover() throws Exception {
        // Given
        ClusterFixture cluster = ClusterFixture.onSecondary();
        PromoteRequestHandler handler = handlerFor(cluster, cluster.orchestrator());

        // When
        PromotionAck ack = handler.handle(request(PeerEvent.PROMOTE_TO_MAIN, SECRET)).block();

        // Then
        assertNotNull(ack);
        assertEquals(PromotionAck.Status.INITIATED, ack.getStatus());
        FailoverResult result = ack.getRun().orElseThrow().get(5, TimeUnit.SECONDS);
        assertTrue(result.isCompleted());
        assertEquals(FailoverTrigger.PEER_PROMOTE, result.getTrigger());
        assertEquals(ServerRole.MAIN, cluster.config().getServerRole());
        assertEquals(List.of(ClusterEventType.PROMOTION_RECEIVED, ClusterEventType.FAILOVER_STARTED,
                ClusterEventType.FAILOVER_COMPLETED), cluster.eventTypes());
        assertEquals(EventSeverity.WARNING, cluster.events().get(0).getSeverity());
    }

    @Test
    @DisplayName("should tag a switchover request with the switchover trigger")
    void shouldTagSwitchover() throws Exception {
        ClusterFixture cluster = ClusterFixture.onSecondary();

        PromotionAck ack = handlerFor(cluster, cluster.orchestrator())
                .handle(request(PeerEvent.SWITCHOVER, SECRET)).block();

        assertEquals(FailoverTrigger.SWITCHOVER, ack.getRun().orElseThrow().get(5, TimeUnit.SECONDS).getTrigger());
    }

    @Test
    @DisplayName("should reject a wrong secret before doing anything")
    void shouldRejectWrongSecret() {
        ClusterFixture cluster = ClusterFixture.onSecondary();

        StepVerifier.create(handlerFor(cluster, cluster.orchestrator())
                        .handle(request(PeerEvent.PROMOTE_TO_MAIN, "guess")))
                .expectError(ClusterAuthenticationException.class)
                .verify();

        assertTrue(cluster.events().isEmpty());
        assertTrue(cluster.replicationDriver.getJournal().isEmpty());
        assertFalse(cluster.guard.isInProgress());
    }

    @Test
    @DisplayName("should reject a promotion request on the main")
    void shouldRejectOnMain() {
        ClusterFixture cluster = ClusterFixture.onMain();

        StepVerifier.create(handlerFor(cluster, cluster.orchestrator())
                        .handle(request(PeerEvent.PROMOTE_TO_MAIN, SECRET)))
                .expectErrorSatisfies(error -> {
                    assertInstanceOf(ClusterConfigurationException.class, error);
                    assertEquals("this server is not a secondary - cannot be promoted", error.getMessage());
                })
                .verify();
    }

    @Test
    @DisplayName("should run a single failover for concurrent requests")
    void shouldRunSingleFailoverForConcurrentRequests() throws Exception {
        // Given - runs are parked until released by the test
        ClusterFixture cluster = ClusterFixture.onSecondary();
        List<Runnable> parked = new CopyOnWriteArrayList<>();
        FailoverOrchestrator orchestrator = cluster.orchestrator(Schedulers.fromExecutor(parked::add));
        PromoteRequestHandler handler = handlerFor(cluster, orchestrator);

        // When
        PromotionAck first = handler.handle(request(PeerEvent.PROMOTE_TO_MAIN, SECRET)).block();
        PromotionAck second = handler.handle(request(PeerEvent.PROMOTE_TO_MAIN, SECRET)).block();

        // Then
        assertEquals(PromotionAck.Status.INITIATED, first.getStatus());
        assertEquals(PromotionAck.Status.ALREADY_IN_PROGRESS, second.getStatus());
        assertTrue(second.getRun().isEmpty());
        assertTrue(cluster.guard.isInProgress());

        // When - let the parked run go
        parked.forEach(Runnable::run);

        // Then
        assertTrue(first.getRun().orElseThrow().get(5, TimeUnit.SECONDS).isCompleted());
        assertEquals(1, cluster.replicationDriver.getJournal().stream().filter("promote"::equals).count());
        assertEquals(1, cluster.eventTypes().stream()
                .filter(type -> type == ClusterEventType.PROMOTION_RECEIVED).count());
        assertFalse(cluster.guard.isInProgress());
    }

    @Test
    @DisplayName("should give the guard back when the caller goes away before the failover starts")
    void shouldReleaseGuardOnCancel() {
        // Given - an event log that never answers
        ClusterFixture cluster = ClusterFixture.onSecondary();
        IClusterEventLog stalled = new InMemoryClusterEventLog() {
            @Override
            public Mono<ClusterEvent> append(ClusterEvent event) {
                return Mono.never();
            }
        };
        PromoteRequestHandler handler = new PromoteRequestHandler(cluster.configStore, stalled,
                cluster.orchestrator(), cluster.clock);

        // When
        Disposable pending = handler.handle(request(PeerEvent.PROMOTE_TO_MAIN, SECRET)).subscribe();
        assertTrue(cluster.guard.isInProgress());
        pending.dispose();

        // Then
        assertFalse(cluster.guard.isInProgress());
        assertTrue(cluster.replicationDriver.getJournal().isEmpty());
        assertTrue(cluster.guard.currentRun().isEmpty());
    }

    @Test
    @DisplayName("should stamp the promotion event with the controller clock")
    void shouldStampEventWithClock() {
        ClusterFixture cluster = ClusterFixture.onSecondary();
        cluster.clock.advance(Duration.ofSeconds(42));

        handlerFor(cluster, cluster.orchestrator()).handle(request(PeerEvent.PROMOTE_TO_MAIN, SECRET)).block();

        assertEquals(START.plusSeconds(42), cluster.events().get(0).getCreatedAt());
    }
}

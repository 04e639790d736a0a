package com.openisp.ha.controller.rest;

import com.openisp.ha.controller.failover.NotifyRequestHandler;
import com.openisp.ha.controller.failover.PromoteRequestHandler;
import com.openisp.ha.controller.membership.ClusterMembershipService;
import com.openisp.ha.controller.rest.dto.ApiResponse;
import com.openisp.ha.controller.rest.dto.PeerAckDto;
import com.openisp.ha.controller.store.IClusterConfigStore;
import com.openisp.ha.model.ClusterConfig;
import com.openisp.ha.model.ServerRole;
import com.openisp.ha.model.peer.JoinRequest;
import com.openisp.ha.model.peer.JoinResponse;
import com.openisp.ha.model.peer.NotifyRequest;
import com.openisp.ha.model.peer.PromoteRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Endpoints called by other cluster members.
 *
 * <table border="1">
 *   <tr><th>Method</th><th>Path</th><th>Description</th></tr>
 *   <tr><td>GET</td><td>/health</td><td>Liveness, polled by secondaries</td></tr>
 *   <tr><td>POST</td><td>/cluster/notify</td><td>New main announcement</td></tr>
 *   <tr><td>POST</td><td>/cluster/promote</td><td>Promotion or switchover request</td></tr>
 *   <tr><td>POST</td><td>/cluster/join</td><td>Admission of a new member, on the main</td></tr>
 * </table>
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class ClusterPeerController {

    private final IClusterConfigStore configStore;
    private final NotifyRequestHandler notifyRequestHandler;
    private final PromoteRequestHandler promoteRequestHandler;
    private final ClusterMembershipService membershipService;

    @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApiResponse<Map<String, String>>>> health() {
        return configStore.load()
                .map(ClusterConfig::getServerRole)
                .defaultIfEmpty(ServerRole.STANDALONE)
                .map(role -> ResponseEntity.ok(ApiResponse.success(Map.of(
                        "status", "ok",
                        "role", role.getValue()))));
    }

    @PostMapping(value = "/cluster/notify",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApiResponse<PeerAckDto>>> handleNotify(@RequestBody NotifyRequest request) {
        log.debug("Cluster notification received: {}", request);

        return notifyRequestHandler.handle(request)
                .map(config -> ResponseEntity.ok(ApiResponse.success(PeerAckDto.processed("Notification processed"))))
                .onErrorResume(e -> ClusterErrorResponses.of("Cluster notification", e));
    }

    @PostMapping(value = "/cluster/promote",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApiResponse<PeerAckDto>>> handlePromote(@RequestBody PromoteRequest request) {
        log.debug("Promotion request received: {}", request);

        return promoteRequestHandler.handle(request)
                .map(ack -> ResponseEntity.ok(ApiResponse.success(PeerAckDto.fromAck(ack))))
                .onErrorResume(e -> ClusterErrorResponses.of("Promotion request", e));
    }

    @PostMapping(value = "/cluster/join",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApiResponse<JoinResponse>>> handleJoin(@RequestBody JoinRequest request) {
        log.debug("Join request received: {}", request);

        return membershipService.acceptJoin(request)
                .map(answer -> ResponseEntity.ok(ApiResponse.success(answer)))
                .onErrorResume(e -> ClusterErrorResponses.of("Join request", e));
    }
}

package com.openisp.ha.controller.rest;

import com.openisp.ha.controller.exception.ClusterConfigurationException;
import com.openisp.ha.controller.failover.ManualFailoverService;
import com.openisp.ha.controller.membership.ClusterMembershipService;
import com.openisp.ha.controller.membership.ClusterSetupResult;
import com.openisp.ha.controller.rest.dto.ApiResponse;
import com.openisp.ha.controller.rest.dto.SetupMainRequest;
import com.openisp.ha.controller.rest.dto.SetupSecondaryRequest;
import com.openisp.ha.controller.rest.dto.TargetNodeRequest;
import com.openisp.ha.controller.switchover.SwitchoverOrchestrator;
import com.openisp.ha.controller.switchover.SwitchoverResult;
import com.openisp.ha.model.ClusterConfig;
import com.openisp.ha.model.ClusterNode;
import com.openisp.ha.model.ClusterStatusView;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Administrator endpoints for cluster control.
 *
 * <table border="1">
 *   <tr><th>Method</th><th>Path</th><th>Description</th></tr>
 *   <tr><td>GET</td><td>/api/v1/cluster/status</td><td>Roster, role and recent events</td></tr>
 *   <tr><td>POST</td><td>/api/v1/cluster/setup-main</td><td>Create a cluster with this server as main</td></tr>
 *   <tr><td>POST</td><td>/api/v1/cluster/setup-secondary</td><td>Join an existing cluster</td></tr>
 *   <tr><td>POST</td><td>/api/v1/cluster/failover</td><td>Ask a secondary to take over</td></tr>
 *   <tr><td>POST</td><td>/api/v1/cluster/switchover</td><td>Planned hand-over to a secondary</td></tr>
 *   <tr><td>DELETE</td><td>/api/v1/cluster/nodes/{id}</td><td>Remove a roster member</td></tr>
 *   <tr><td>POST</td><td>/api/v1/cluster/leave</td><td>Return this node to standalone</td></tr>
 * </table>
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/cluster")
@RequiredArgsConstructor
public class ClusterAdminController {

    private final ManualFailoverService manualFailoverService;
    private final SwitchoverOrchestrator switchoverOrchestrator;
    private final ClusterMembershipService membershipService;

    @GetMapping(value = "/status", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApiResponse<ClusterStatusView>>> status() {
        return membershipService.status()
                .map(view -> ResponseEntity.ok(ApiResponse.success(view)))
                .onErrorResume(e -> ClusterErrorResponses.of("Cluster status", e));
    }

    @PostMapping(value = "/setup-main", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApiResponse<ClusterSetupResult>>> setupMain(
            @RequestBody(required = false) SetupMainRequest request) {
        SetupMainRequest body = request != null ? request : new SetupMainRequest();
        log.info("Cluster setup requested: main {}", body.getServerIp() != null ? body.getServerIp() : "(detected)");

        return membershipService.setupMain(body.getServerName(), body.getServerIp())
                .map(result -> ResponseEntity.ok(ApiResponse.success(result)))
                .onErrorResume(e -> ClusterErrorResponses.of("Setup main", e));
    }

    @PostMapping(value = "/setup-secondary",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApiResponse<ClusterConfig>>> setupSecondary(@RequestBody SetupSecondaryRequest request) {
        log.info("Joining cluster of main {}", request.getMainServerIp());

        return membershipService.setupSecondary(request.getMainServerIp(), request.getClusterSecret(),
                        request.getServerName(), request.getServerIp(), request.getServerRole())
                .map(config -> ResponseEntity.ok(ApiResponse.success(config)))
                .onErrorResume(e -> ClusterErrorResponses.of("Setup secondary", e));
    }

    /**
     * Manual failover. Answers once the target accepted the promotion request;
     * the target runs the failover on its own.
     */
    @PostMapping(value = "/failover",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApiResponse<ClusterNode>>> failover(@RequestBody TargetNodeRequest request) {
        log.info("Manual failover requested: target={}", request.getTargetNodeId());

        return requireTarget(request)
                .flatMap(manualFailoverService::initiate)
                .map(target -> ResponseEntity.ok(ApiResponse.success(target)))
                .onErrorResume(e -> ClusterErrorResponses.of("Manual failover", e));
    }

    @PostMapping(value = "/switchover",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApiResponse<SwitchoverResult>>> switchover(@RequestBody TargetNodeRequest request) {
        log.info("Switchover requested: target={}", request.getTargetNodeId());

        return requireTarget(request)
                .flatMap(switchoverOrchestrator::switchoverTo)
                .map(result -> ResponseEntity.ok(ApiResponse.success(result)))
                .onErrorResume(e -> ClusterErrorResponses.of("Switchover", e));
    }

    @DeleteMapping(value = "/nodes/{nodeId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApiResponse<ClusterNode>>> removeNode(@PathVariable long nodeId) {
        return membershipService.removeNode(nodeId)
                .map(node -> ResponseEntity.ok(ApiResponse.success(node)))
                .onErrorResume(e -> ClusterErrorResponses.of("Remove node", e));
    }

    @PostMapping(value = "/leave", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApiResponse<ClusterConfig>>> leave() {
        return membershipService.leaveCluster()
                .map(config -> ResponseEntity.ok(ApiResponse.success(config)))
                .onErrorResume(e -> ClusterErrorResponses.of("Leave cluster", e));
    }

    private static Mono<Long> requireTarget(TargetNodeRequest request) {
        if (request == null || request.getTargetNodeId() == null) {
            return Mono.error(new ClusterConfigurationException("target_node_id is required"));
        }
        return Mono.just(request.getTargetNodeId());
    }
}

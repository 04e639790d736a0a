package com.openisp.ha.controller.peer.impl;

import com.openisp.ha.controller.exception.PeerRequestException;
import com.openisp.ha.controller.peer.IPeerNotifier;
import com.openisp.ha.controller.peer.PeerBroadcastResult;
import com.openisp.ha.controller.rest.dto.ApiResponse;
import com.openisp.ha.model.ClusterConfig;
import com.openisp.ha.model.ClusterNode;
import com.openisp.ha.model.peer.JoinRequest;
import com.openisp.ha.model.peer.JoinResponse;
import com.openisp.ha.model.peer.NotifyRequest;
import com.openisp.ha.model.peer.PromoteRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Peer notifier posting JSON control messages with WebClient.
 *
 * <ul>
 *   <li>{@code POST http://peer:port/cluster/notify} - new main announcement</li>
 *   <li>{@code POST http://peer:port/cluster/promote} - promotion and switchover requests</li>
 *   <li>{@code POST http://main:port/cluster/join} - admission of a new member</li>
 * </ul>
 *
 * The cluster secret travels in the JSON body; there is no signature or replay protection.
 */
@Slf4j
public class WebClientPeerNotifier implements IPeerNotifier {

    static final String NOTIFY_PATH = "/cluster/notify";
    static final String PROMOTE_PATH = "/cluster/promote";
    static final String JOIN_PATH = "/cluster/join";

    private static final ParameterizedTypeReference<ApiResponse<JoinResponse>> JOIN_ANSWER =
            new ParameterizedTypeReference<>() {
            };

    private final WebClient webClient;
    private final int peerPort;
    private final Duration timeout;
    private final Clock clock;

    public WebClientPeerNotifier(WebClient webClient, int peerPort, Duration timeout, Clock clock) {
        this.webClient = Objects.requireNonNull(webClient);
        this.peerPort = peerPort;
        this.timeout = Objects.requireNonNull(timeout);
        this.clock = Objects.requireNonNull(clock);
    }

    @Override
    public Mono<PeerBroadcastResult> broadcastNewMain(ClusterConfig self, List<ClusterNode> peers) {
        if (peers.isEmpty()) {
            log.info("No other cluster members to notify");
            return Mono.just(PeerBroadcastResult.empty());
        }

        NotifyRequest notification = NotifyRequest.newMain(
                self.getServerIp(), self.getClusterId(), self.getClusterSecret(), clock.instant());

        return Flux.fromIterable(peers)
                .flatMap(peer -> post(peer.getServerIp(), NOTIFY_PATH, notification)
                        .thenReturn(Outcome.delivered(peer.getServerIp()))
                        .onErrorResume(error -> {
                            log.warn("Failed to notify {} of new main: {}", peer.getServerIp(), error.getMessage());
                            return Mono.just(Outcome.failed(peer.getServerIp(), error.getMessage()));
                        }))
                .collectList()
                .map(WebClientPeerNotifier::aggregate);
    }

    @Override
    public Mono<Void> requestPromotion(ClusterNode target, PromoteRequest request) {
        return post(target.getServerIp(), PROMOTE_PATH, request)
                .doOnSuccess(ignored -> log.info("Node {} accepted {} request",
                        target.getServerIp(), request.getEvent().getValue()));
    }

    @Override
    public Mono<JoinResponse> requestJoin(String mainIp, JoinRequest request) {
        String address = mainIp + ":" + peerPort;
        return webClient.post()
                .uri("http://" + address + JOIN_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .exchangeToMono(response -> {
                    int status = response.statusCode().value();
                    return response.bodyToMono(JOIN_ANSWER)
                            .flatMap(answer -> {
                                if (status == 200 && answer.isSuccess() && answer.getData() != null) {
                                    return Mono.just(answer.getData());
                                }
                                if (answer.getError() != null) {
                                    return Mono.error(new PeerRequestException(address, status, answer.getError()));
                                }
                                return Mono.error(new PeerRequestException(address, status));
                            })
                            .switchIfEmpty(Mono.error(() -> new PeerRequestException(address, status)));
                })
                .timeout(timeout)
                .onErrorMap(error -> !(error instanceof PeerRequestException),
                        error -> new PeerRequestException(address, error))
                .doOnSuccess(answer -> log.info("Joined cluster {} through main {} as {}",
                        answer.getClusterId(), address, answer.getAssignedRole()));
    }

    private Mono<Void> post(String peerIp, String path, Object body) {
        String address = peerIp + ":" + peerPort;
        return webClient.post()
                .uri("http://" + address + path)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchangeToMono(response -> {
                    int status = response.statusCode().value();
                    if (status == 200) {
                        return response.releaseBody();
                    }
                    return response.releaseBody().then(Mono.error(new PeerRequestException(address, status)));
                })
                .timeout(timeout)
                .onErrorMap(error -> !(error instanceof PeerRequestException),
                        error -> new PeerRequestException(address, error));
    }

    private static PeerBroadcastResult aggregate(List<Outcome> outcomes) {
        List<String> delivered = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        for (Outcome outcome : outcomes) {
            if (outcome.error == null) {
                delivered.add(outcome.peerIp);
                log.info("Notified {} of new main", outcome.peerIp);
            } else {
                failed.put(outcome.peerIp, outcome.error);
            }
        }
        return new PeerBroadcastResult(delivered, failed);
    }

    private static final class Outcome {
        final String peerIp;
        final String error;

        private Outcome(String peerIp, String error) {
            this.peerIp = peerIp;
            this.error = error;
        }

        static Outcome delivered(String peerIp) {
            return new Outcome(peerIp, null);
        }

        static Outcome failed(String peerIp, String error) {
            return new Outcome(peerIp, error != null ? error : "unknown error");
        }
    }
}

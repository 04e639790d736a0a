package com.openisp.ha.controller.peer;

import com.openisp.ha.model.ClusterConfig;
import com.openisp.ha.model.ClusterNode;
import com.openisp.ha.model.peer.JoinRequest;
import com.openisp.ha.model.peer.JoinResponse;
import com.openisp.ha.model.peer.PromoteRequest;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Sends authenticated control messages to other cluster members.
 */
public interface IPeerNotifier {

    /**
     * Announces {@code self} as the new main to every peer.
     *
     * Each peer call has its own timeout; unreachable peers are recorded in the
     * result and do not stop delivery to the rest.
     *
     * @param self the config of the freshly promoted node
     * @param peers roster members other than {@code self}
     * @return Mono containing the per-peer outcome; never signals an error
     */
    Mono<PeerBroadcastResult> broadcastNewMain(ClusterConfig self, List<ClusterNode> peers);

    /**
     * Asks {@code target} to run its failover pipeline.
     *
     * @return Mono completing when the target answered HTTP 200; signals
     *         {@link com.openisp.ha.controller.exception.PeerRequestException} otherwise
     */
    Mono<Void> requestPromotion(ClusterNode target, PromoteRequest request);

    /**
     * Asks the main at {@code mainIp} to admit this server.
     *
     * @return Mono with the main's answer; signals
     *         {@link com.openisp.ha.controller.exception.PeerRequestException} on a network error or
     *         a non-200 answer, carrying the main's error message when it sent one
     */
    Mono<JoinResponse> requestJoin(String mainIp, JoinRequest request);
}

package com.openisp.ha.model.peer;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Body of {@code POST /cluster/promote}.
 *
 * The event is either {@link PeerEvent#PROMOTE_TO_MAIN} (manual failover) or
 * {@link PeerEvent#SWITCHOVER} (planned role exchange).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = "clusterSecret")
public class PromoteRequest {

    @JsonProperty("event")
    private PeerEvent event;

    @JsonProperty("current_main")
    private String currentMain;

    @JsonProperty("cluster_id")
    private String clusterId;

    @JsonProperty("cluster_secret")
    private String clusterSecret;

    public static PromoteRequest of(PeerEvent event, String currentMain, String clusterId, String clusterSecret) {
        return PromoteRequest.builder()
                .event(event)
                .currentMain(currentMain)
                .clusterId(clusterId)
                .clusterSecret(clusterSecret)
                .build();
    }
}

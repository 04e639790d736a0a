package com.openisp.ha.model.peer;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * Body of {@code POST /cluster/notify}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = "clusterSecret")
public class NotifyRequest {

    @JsonProperty("event")
    private PeerEvent event;

    @JsonProperty("new_main_ip")
    private String newMainIp;

    @JsonProperty("cluster_id")
    private String clusterId;

    @JsonProperty("cluster_secret")
    private String clusterSecret;

    @JsonProperty("timestamp")
    private Instant timestamp;

    public static NotifyRequest newMain(String newMainIp, String clusterId, String clusterSecret, Instant now) {
        return NotifyRequest.builder()
                .event(PeerEvent.NEW_MAIN)
                .newMainIp(newMainIp)
                .clusterId(clusterId)
                .clusterSecret(clusterSecret)
                .timestamp(now)
                .build();
    }
}

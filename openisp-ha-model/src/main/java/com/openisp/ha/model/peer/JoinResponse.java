package com.openisp.ha.model.peer;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.openisp.ha.model.ServerRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What the main tells a server it just admitted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JoinResponse {

    @JsonProperty("cluster_id")
    private String clusterId;

    @JsonProperty("assigned_role")
    private ServerRole assignedRole;

    @JsonProperty("main_server_ip")
    private String mainServerIp;

    /**
     * Physical replication slot the joining server should stream from.
     */
    @JsonProperty("replication_slot")
    private String replicationSlot;
}

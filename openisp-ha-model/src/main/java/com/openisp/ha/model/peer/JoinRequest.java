package com.openisp.ha.model.peer;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.openisp.ha.model.ServerRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Body of {@code POST /cluster/join}, sent by a server asking the main to admit it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = "clusterSecret")
public class JoinRequest {

    @JsonProperty("cluster_secret")
    private String clusterSecret;

    @JsonProperty("hardware_id")
    private String hardwareId;

    @JsonProperty("server_name")
    private String serverName;

    @JsonProperty("server_ip")
    private String serverIp;

    @JsonProperty("requested_role")
    private ServerRole requestedRole;
}

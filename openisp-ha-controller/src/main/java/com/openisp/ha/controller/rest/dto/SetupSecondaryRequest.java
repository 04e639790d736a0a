package com.openisp.ha.controller.rest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.openisp.ha.model.ServerRole;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Body of the setup-secondary request.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = "clusterSecret")
public class SetupSecondaryRequest {

    @JsonProperty("main_server_ip")
    private String mainServerIp;

    @JsonProperty("cluster_secret")
    private String clusterSecret;

    @JsonProperty("server_name")
    private String serverName;

    @JsonProperty("server_ip")
    private String serverIp;

    /**
     * secondary (default) or server3.
     */
    @JsonProperty("server_role")
    private ServerRole serverRole;
}

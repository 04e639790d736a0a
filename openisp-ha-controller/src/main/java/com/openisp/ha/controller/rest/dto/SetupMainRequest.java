package com.openisp.ha.controller.rest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of the setup-main request. Both fields are optional.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SetupMainRequest {

    @JsonProperty("server_name")
    private String serverName;

    @JsonProperty("server_ip")
    private String serverIp;
}

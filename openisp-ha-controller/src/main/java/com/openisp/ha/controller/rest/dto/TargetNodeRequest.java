package com.openisp.ha.controller.rest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of the manual failover and switchover requests.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TargetNodeRequest {

    @JsonProperty("target_node_id")
    private Long targetNodeId;
}

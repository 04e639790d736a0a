package com.openisp.ha.controller.membership;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * What an operator needs after creating a cluster: the secret is shown once
 * and must be handed to every server that joins.
 */
@Getter
@Builder
@ToString(exclude = "clusterSecret")
public final class ClusterSetupResult {

    private final String clusterId;
    private final String clusterSecret;
    private final String serverIp;
}

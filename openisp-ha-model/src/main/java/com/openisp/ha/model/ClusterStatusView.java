package com.openisp.ha.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Read-only snapshot of the cluster for the administrator surface.
 */
@Getter
@Builder
@ToString
public final class ClusterStatusView {

    private final String clusterId;
    private final boolean clustered;
    private final ServerRole serverRole;
    private final String mainServerIp;
    private final boolean autoFailoverEnabled;
    private final int totalNodes;
    private final int onlineNodes;
    private final List<ClusterNode> nodes;
    private final List<ClusterEvent> recentEvents;

    public static ClusterStatusView standalone() {
        return ClusterStatusView.builder()
                .clustered(false)
                .serverRole(ServerRole.STANDALONE)
                .nodes(List.of())
                .recentEvents(List.of())
                .build();
    }
}

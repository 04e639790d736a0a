package com.openisp.ha.controller.switchover;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Outcome of a completed switchover, as seen by the former main.
 */
@Getter
@Builder
@ToString
public final class SwitchoverResult {

    private final String formerMainIp;
    private final String newMainIp;
    private final long targetNodeId;
    private final long replicationLagBytes;
    private final String replicationSlot;
    private final Instant startedAt;
    private final Instant completedAt;
}

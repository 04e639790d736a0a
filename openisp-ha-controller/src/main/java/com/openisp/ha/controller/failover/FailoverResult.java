package com.openisp.ha.controller.failover;

import com.openisp.ha.controller.peer.PeerBroadcastResult;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Outcome of one failover run.
 */
@Getter
@Builder
@ToString
public final class FailoverResult {

    public enum Status {
        COMPLETED,
        FAILED
    }

    private final Status status;
    private final FailoverTrigger trigger;
    private final String formerMainIp;
    private final String newMainIp;
    private final Long replicationLagSeconds;
    private final PeerBroadcastResult peers;
    private final boolean authServiceRestarted;
    private final String errorMessage;
    private final Instant startedAt;
    private final Instant completedAt;

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }

    public static FailoverResult failed(FailoverTrigger trigger, String errorMessage, Instant startedAt, Instant completedAt) {
        return FailoverResult.builder()
                .status(Status.FAILED)
                .trigger(trigger)
                .errorMessage(errorMessage)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .build();
    }
}

package com.openisp.ha.controller.failover;

import lombok.Getter;
import lombok.ToString;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Immediate answer to a promotion request. The failover itself continues in the background.
 */
@Getter
@ToString
public final class PromotionAck {

    public enum Status {
        INITIATED,
        ALREADY_IN_PROGRESS
    }

    private final Status status;
    private final String message;
    @ToString.Exclude
    private final CompletableFuture<FailoverResult> run;

    private PromotionAck(Status status, String message, CompletableFuture<FailoverResult> run) {
        this.status = status;
        this.message = message;
        this.run = run;
    }

    public static PromotionAck initiated(CompletableFuture<FailoverResult> run) {
        return new PromotionAck(Status.INITIATED, "Promotion initiated", run);
    }

    public static PromotionAck alreadyInProgress() {
        return new PromotionAck(Status.ALREADY_IN_PROGRESS, "Failover already in progress", null);
    }

    public Optional<CompletableFuture<FailoverResult>> getRun() {
        return Optional.ofNullable(run);
    }
}

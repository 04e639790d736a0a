package com.openisp.ha.controller.failover;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Per-node failover state shared by the monitor and the promote handler.
 *
 * Holds the time of the last successful main health check and the in-progress
 * flag. At most one failover runs on a node at a time: both entry points must
 * acquire the guard, and the run releases it when it finishes, whatever the outcome.
 *
 * Thread Safety: all methods synchronize on this instance.
 */
@Slf4j
public class FailoverGuard {

    private final Clock clock;

    private boolean inProgress;
    private Instant lastMainHeartbeat;
    private CompletableFuture<FailoverResult> currentRun;

    public FailoverGuard(Clock clock) {
        this.clock = Objects.requireNonNull(clock);
        this.lastMainHeartbeat = clock.instant();
    }

    /**
     * Acquires the guard unconditionally.
     *
     * @return true if acquired, false if a failover is already running
     */
    public synchronized boolean tryAcquire() {
        if (inProgress) {
            return false;
        }
        inProgress = true;
        return true;
    }

    /**
     * Acquires the guard only if the main has been silent for at least {@code threshold}.
     * The check and the flag update happen atomically.
     *
     * @return true if acquired
     */
    public synchronized boolean tryAcquireIfOutageExceeds(Duration threshold) {
        if (inProgress) {
            return false;
        }
        if (timeSinceMainHeartbeat().compareTo(threshold) < 0) {
            return false;
        }
        inProgress = true;
        return true;
    }

    public synchronized void release() {
        if (!inProgress) {
            log.debug("Failover guard released while not held");
        }
        inProgress = false;
    }

    public synchronized boolean isInProgress() {
        return inProgress;
    }

    public synchronized void recordMainHeartbeat() {
        lastMainHeartbeat = clock.instant();
    }

    public synchronized Instant getLastMainHeartbeat() {
        return lastMainHeartbeat;
    }

    public synchronized Duration timeSinceMainHeartbeat() {
        return Duration.between(lastMainHeartbeat, clock.instant());
    }

    synchronized void track(CompletableFuture<FailoverResult> run) {
        currentRun = run;
    }

    /**
     * Returns the most recently launched run, which may already be finished.
     */
    public synchronized Optional<CompletableFuture<FailoverResult>> currentRun() {
        return Optional.ofNullable(currentRun);
    }
}

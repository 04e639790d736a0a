package com.openisp.ha.controller.replication;

import reactor.core.publisher.Mono;

/**
 * Narrow contract over the replicated data store and the secondary cache link.
 *
 * Role changes issued here are irreversible from the controller's point of view;
 * callers must not issue a later step before the returned Mono completes.
 */
public interface IReplicationDriver {

    /**
     * Checks if the local data store is currently a replica replaying from a primary.
     */
    Mono<Boolean> isInRecovery();

    /**
     * Promotes the local data store to a writable primary.
     */
    Mono<Void> promoteToMain();

    /**
     * Reconfigures the local data store to follow {@code newPrimaryHost}.
     *
     * @param newPrimaryHost address of the new primary
     * @param slotName replication slot reserved for this node on the new primary
     */
    Mono<Void> demoteToReplica(String newPrimaryHost, String slotName);

    /**
     * Replay delay of the local replica, in seconds. Zero on a primary.
     */
    Mono<Long> replicationLagSeconds();

    /**
     * Bytes between this primary's write position and {@code replicaHost}'s replay position.
     */
    Mono<Long> replicationLagBytes(String replicaHost);

    /**
     * Fences or unfences the local primary. A fenced primary rejects new writes;
     * the change is applied live.
     */
    Mono<Void> setWritesFenced(boolean fenced);

    /**
     * Stops the local cache from following any primary.
     */
    Mono<Void> stopCacheReplication(String credential);

    /**
     * Points the local cache at {@code mainHost}.
     */
    Mono<Void> followCache(String mainHost, String credential);

    /**
     * Reserves a physical replication slot on the local primary. Does nothing if it already exists.
     */
    Mono<Void> ensureReplicationSlot(String slotName);
}

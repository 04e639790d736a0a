package com.openisp.ha.controller.store;

import com.openisp.ha.model.ClusterEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Append-only audit log of cluster transitions. Entries are never changed or removed.
 */
public interface IClusterEventLog {

    /**
     * Appends an event.
     *
     * @param event the event
     * @return Mono containing the stored event with its id assigned
     */
    Mono<ClusterEvent> append(ClusterEvent event);

    /**
     * Returns every event of a cluster, oldest first.
     */
    Flux<ClusterEvent> findByClusterId(String clusterId);

    /**
     * Returns the newest events of a cluster, newest first.
     *
     * @param clusterId the cluster
     * @param limit maximum number of events
     */
    Flux<ClusterEvent> findRecent(String clusterId, int limit);
}

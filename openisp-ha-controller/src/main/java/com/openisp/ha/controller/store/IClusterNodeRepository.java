package com.openisp.ha.controller.store;

import com.openisp.ha.model.ClusterNode;
import com.openisp.ha.model.NodeStatus;
import com.openisp.ha.model.ServerRole;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Repository of cluster roster rows.
 *
 * The roster is shared by all nodes and may be written concurrently; no locking
 * beyond what the backing store offers is assumed.
 */
public interface IClusterNodeRepository {

    /**
     * Inserts or replaces a roster row. A row with id 0 gets a new id.
     *
     * @param node the row to save
     * @return Mono containing the saved row
     */
    Mono<ClusterNode> save(ClusterNode node);

    Mono<Optional<ClusterNode>> findById(long id);

    Mono<Optional<ClusterNode>> findByHardwareId(String hardwareId);

    Flux<ClusterNode> findByClusterId(String clusterId);

    /**
     * Sets the status of every row registered under {@code serverIp}.
     *
     * @return Mono containing the number of rows changed
     */
    Mono<Integer> updateStatusByServerIp(String serverIp, NodeStatus status);

    /**
     * Sets role and status of the row identified by {@code hardwareId}.
     *
     * @return Mono containing true if a row was changed
     */
    Mono<Boolean> updateRoleAndStatusByHardwareId(String hardwareId, ServerRole role, NodeStatus status);

    Mono<Boolean> deleteById(long id);

    Mono<Boolean> deleteByHardwareId(String hardwareId);

    /**
     * Deletes every row of a cluster.
     *
     * @return Mono containing the number of rows removed
     */
    Mono<Integer> deleteByClusterId(String clusterId);
}

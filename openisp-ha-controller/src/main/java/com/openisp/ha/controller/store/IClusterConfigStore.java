package com.openisp.ha.controller.store;

import com.openisp.ha.model.ClusterConfig;
import reactor.core.publisher.Mono;

import java.util.function.UnaryOperator;

/**
 * Durable storage of the local node's {@link ClusterConfig}.
 *
 * Updates are serialized per node: {@link #update(UnaryOperator)} applies the
 * transformation under the store's mutex so concurrent role transitions on one
 * node cannot interleave.
 */
public interface IClusterConfigStore {

    /**
     * Loads the local config.
     *
     * @return Mono with the config, or empty if this node was never configured
     */
    Mono<ClusterConfig> load();

    /**
     * Replaces the local config.
     *
     * @param config the new config
     * @return Mono with the saved config
     */
    Mono<ClusterConfig> save(ClusterConfig config);

    /**
     * Atomically transforms the stored config.
     *
     * @param transformation applied to the current config
     * @return Mono with the saved config, or empty if nothing is stored
     */
    Mono<ClusterConfig> update(UnaryOperator<ClusterConfig> transformation);
}

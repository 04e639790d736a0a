package com.openisp.ha.controller.store.impl;

import com.openisp.ha.controller.store.IClusterConfigStore;
import com.openisp.ha.model.ClusterConfig;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * In-memory implementation of IClusterConfigStore.
 *
 * Suitable for development and tests. Data is NOT persisted across JVM restarts.
 */
@Slf4j
public class InMemoryClusterConfigStore implements IClusterConfigStore {

    private final Object lock = new Object();
    private ClusterConfig current;

    public InMemoryClusterConfigStore() {
        this(null);
    }

    public InMemoryClusterConfigStore(ClusterConfig initial) {
        this.current = initial;
    }

    @Override
    public Mono<ClusterConfig> load() {
        return Mono.fromCallable(() -> {
            synchronized (lock) {
                return current;
            }
        });
    }

    @Override
    public Mono<ClusterConfig> save(ClusterConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        return Mono.fromCallable(() -> {
            synchronized (lock) {
                current = config;
            }
            log.debug("Saved cluster config: role={}, main={}", config.getServerRole(), config.getMainServerIp());
            return config;
        });
    }

    @Override
    public Mono<ClusterConfig> update(UnaryOperator<ClusterConfig> transformation) {
        Objects.requireNonNull(transformation, "transformation must not be null");
        return Mono.fromCallable(() -> {
            synchronized (lock) {
                if (current == null) {
                    return null;
                }
                current = Objects.requireNonNull(transformation.apply(current), "transformation returned null");
                log.debug("Updated cluster config: role={}, main={}", current.getServerRole(), current.getMainServerIp());
                return current;
            }
        });
    }
}

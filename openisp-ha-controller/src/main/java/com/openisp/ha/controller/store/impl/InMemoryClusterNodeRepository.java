package com.openisp.ha.controller.store.impl;

import com.openisp.ha.controller.store.IClusterNodeRepository;
import com.openisp.ha.model.ClusterNode;
import com.openisp.ha.model.NodeStatus;
import com.openisp.ha.model.ServerRole;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of IClusterNodeRepository.
 *
 * Thread Safety: This class is thread-safe using ConcurrentHashMap and atomic operations.
 *
 * Note: Data is NOT persisted across JVM restarts.
 */
@Slf4j
public class InMemoryClusterNodeRepository implements IClusterNodeRepository {

    private final ConcurrentHashMap<Long, ClusterNode> nodesById = new ConcurrentHashMap<>();
    private final AtomicLong idGenerator = new AtomicLong(0);

    @Override
    public Mono<ClusterNode> save(ClusterNode node) {
        Objects.requireNonNull(node, "node must not be null");
        return Mono.fromCallable(() -> {
            ClusterNode stored = node.getId() > 0 ? node : node.withId(idGenerator.incrementAndGet());
            idGenerator.accumulateAndGet(stored.getId(), Math::max);
            nodesById.put(stored.getId(), stored);
            log.debug("Saved roster row {}: ip={}, role={}, status={}",
                    stored.getId(), stored.getServerIp(), stored.getServerRole(), stored.getStatus());
            return stored;
        });
    }

    @Override
    public Mono<Optional<ClusterNode>> findById(long id) {
        return Mono.fromCallable(() -> Optional.ofNullable(nodesById.get(id)));
    }

    @Override
    public Mono<Optional<ClusterNode>> findByHardwareId(String hardwareId) {
        Objects.requireNonNull(hardwareId, "hardwareId must not be null");
        return Mono.fromCallable(() -> nodesById.values().stream()
                .filter(node -> hardwareId.equals(node.getHardwareId()))
                .findFirst());
    }

    @Override
    public Flux<ClusterNode> findByClusterId(String clusterId) {
        Objects.requireNonNull(clusterId, "clusterId must not be null");
        return Flux.defer(() -> Flux.fromIterable(snapshot()))
                .filter(node -> clusterId.equals(node.getClusterId()));
    }

    @Override
    public Mono<Integer> updateStatusByServerIp(String serverIp, NodeStatus status) {
        Objects.requireNonNull(serverIp, "serverIp must not be null");
        return Mono.fromCallable(() -> {
            int changed = 0;
            for (ClusterNode node : snapshot()) {
                if (serverIp.equals(node.getServerIp())) {
                    nodesById.put(node.getId(), node.withStatus(status));
                    changed++;
                }
            }
            return changed;
        });
    }

    @Override
    public Mono<Boolean> updateRoleAndStatusByHardwareId(String hardwareId, ServerRole role, NodeStatus status) {
        Objects.requireNonNull(hardwareId, "hardwareId must not be null");
        return Mono.fromCallable(() -> {
            boolean changed = false;
            for (ClusterNode node : snapshot()) {
                if (hardwareId.equals(node.getHardwareId())) {
                    nodesById.put(node.getId(), node.withRoleAndStatus(role, status));
                    changed = true;
                }
            }
            return changed;
        });
    }

    @Override
    public Mono<Boolean> deleteById(long id) {
        return Mono.fromCallable(() -> nodesById.remove(id) != null);
    }

    @Override
    public Mono<Boolean> deleteByHardwareId(String hardwareId) {
        Objects.requireNonNull(hardwareId, "hardwareId must not be null");
        return Mono.fromCallable(() -> nodesById.values().removeIf(node -> hardwareId.equals(node.getHardwareId())));
    }

    @Override
    public Mono<Integer> deleteByClusterId(String clusterId) {
        Objects.requireNonNull(clusterId, "clusterId must not be null");
        return Mono.fromCallable(() -> {
            int before = nodesById.size();
            nodesById.values().removeIf(node -> clusterId.equals(node.getClusterId()));
            return before - nodesById.size();
        });
    }

    private List<ClusterNode> snapshot() {
        return nodesById.values().stream()
                .sorted(Comparator.comparingLong(ClusterNode::getId))
                .toList();
    }
}

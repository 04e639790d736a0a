package com.openisp.ha.controller.store.impl;

import com.openisp.ha.controller.store.IClusterEventLog;
import com.openisp.ha.model.ClusterEvent;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of IClusterEventLog.
 *
 * Note: Data is NOT persisted across JVM restarts.
 */
@Slf4j
public class InMemoryClusterEventLog implements IClusterEventLog {

    private final List<ClusterEvent> events = new CopyOnWriteArrayList<>();
    private final AtomicLong idGenerator = new AtomicLong(0);

    @Override
    public Mono<ClusterEvent> append(ClusterEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        return Mono.fromCallable(() -> {
            ClusterEvent stored = event.withId(idGenerator.incrementAndGet());
            events.add(stored);
            log.debug("Cluster event {} [{}]: {}", stored.getEventType().getValue(),
                    stored.getSeverity().getValue(), stored.getDescription());
            return stored;
        });
    }

    @Override
    public Flux<ClusterEvent> findByClusterId(String clusterId) {
        return Flux.defer(() -> Flux.fromIterable(events))
                .filter(event -> Objects.equals(clusterId, event.getClusterId()));
    }

    @Override
    public Flux<ClusterEvent> findRecent(String clusterId, int limit) {
        return Flux.defer(() -> {
            List<ClusterEvent> matching = new ArrayList<>();
            for (ClusterEvent event : events) {
                if (Objects.equals(clusterId, event.getClusterId())) {
                    matching.add(event);
                }
            }
            Collections.reverse(matching);
            return Flux.fromIterable(matching);
        }).take(Math.max(limit, 0));
    }
}

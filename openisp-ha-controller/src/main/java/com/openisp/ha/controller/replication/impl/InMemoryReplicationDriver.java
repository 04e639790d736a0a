package com.openisp.ha.controller.replication.impl;

import com.openisp.ha.controller.replication.IReplicationDriver;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Simulated replication driver that keeps data-store and cache roles in memory.
 *
 * Used for development and tests. Failures can be injected per operation, and
 * every call is journaled so callers can check the order of side effects.
 *
 * Thread Safety: all state is guarded by the instance monitor.
 */
@Slf4j
public class InMemoryReplicationDriver implements IReplicationDriver {

    public enum StoreRole { PRIMARY, REPLICA }

    private StoreRole storeRole;
    private boolean writesFenced;
    private String followedPrimary;
    private String slotName;
    private String cacheFollowing;
    private long lagSeconds;
    private final Map<String, Long> lagBytesByReplica = new HashMap<>();
    private final Set<String> reservedSlots = new LinkedHashSet<>();
    private final List<String> journal = new ArrayList<>();

    private RuntimeException promoteFailure;
    private RuntimeException demoteFailure;
    private RuntimeException lagFailure;
    private RuntimeException cacheFailure;

    public InMemoryReplicationDriver(StoreRole initialRole) {
        this.storeRole = initialRole;
    }

    public static InMemoryReplicationDriver primary() {
        return new InMemoryReplicationDriver(StoreRole.PRIMARY);
    }

    public static InMemoryReplicationDriver replicaOf(String primaryHost) {
        InMemoryReplicationDriver driver = new InMemoryReplicationDriver(StoreRole.REPLICA);
        driver.followedPrimary = primaryHost;
        driver.cacheFollowing = primaryHost;
        return driver;
    }

    @Override
    public Mono<Boolean> isInRecovery() {
        return Mono.fromCallable(() -> {
            synchronized (this) {
                return storeRole == StoreRole.REPLICA;
            }
        });
    }

    @Override
    public Mono<Void> promoteToMain() {
        return Mono.fromRunnable(() -> {
            synchronized (this) {
                journal.add("promote");
                if (promoteFailure != null) {
                    throw promoteFailure;
                }
                storeRole = StoreRole.PRIMARY;
                followedPrimary = null;
                slotName = null;
                writesFenced = false;
            }
            log.info("Data store promoted to primary");
        });
    }

    @Override
    public Mono<Void> demoteToReplica(String newPrimaryHost, String slot) {
        return Mono.fromRunnable(() -> {
            synchronized (this) {
                journal.add("demote:" + newPrimaryHost + ":" + slot);
                if (demoteFailure != null) {
                    throw demoteFailure;
                }
                storeRole = StoreRole.REPLICA;
                followedPrimary = newPrimaryHost;
                slotName = slot;
                writesFenced = false;
            }
            log.info("Data store now replicating from {} using slot {}", newPrimaryHost, slot);
        });
    }

    @Override
    public Mono<Long> replicationLagSeconds() {
        return Mono.fromCallable(() -> {
            synchronized (this) {
                journal.add("lag-seconds");
                if (lagFailure != null) {
                    throw lagFailure;
                }
                return storeRole == StoreRole.PRIMARY ? 0L : lagSeconds;
            }
        });
    }

    @Override
    public Mono<Long> replicationLagBytes(String replicaHost) {
        return Mono.fromCallable(() -> {
            synchronized (this) {
                journal.add("lag-bytes:" + replicaHost);
                if (lagFailure != null) {
                    throw lagFailure;
                }
                return lagBytesByReplica.getOrDefault(replicaHost, 0L);
            }
        });
    }

    @Override
    public Mono<Void> setWritesFenced(boolean fenced) {
        return Mono.fromRunnable(() -> {
            synchronized (this) {
                journal.add(fenced ? "fence" : "unfence");
                writesFenced = fenced;
            }
            log.info("Data store writes {}", fenced ? "fenced (read-only)" : "re-enabled");
        });
    }

    @Override
    public Mono<Void> stopCacheReplication(String credential) {
        return Mono.fromRunnable(() -> {
            synchronized (this) {
                journal.add("cache-stop");
                if (cacheFailure != null) {
                    throw cacheFailure;
                }
                cacheFollowing = null;
            }
        });
    }

    @Override
    public Mono<Void> followCache(String mainHost, String credential) {
        return Mono.fromRunnable(() -> {
            synchronized (this) {
                journal.add("cache-follow:" + mainHost);
                if (cacheFailure != null) {
                    throw cacheFailure;
                }
                cacheFollowing = mainHost;
            }
        });
    }

    @Override
    public Mono<Void> ensureReplicationSlot(String slot) {
        return Mono.fromRunnable(() -> {
            synchronized (this) {
                journal.add("slot:" + slot);
                reservedSlots.add(slot);
            }
        });
    }

    // ========== Failure injection and inspection ==========

    public synchronized void failPromotionWith(RuntimeException failure) {
        this.promoteFailure = failure;
    }

    public synchronized void failDemotionWith(RuntimeException failure) {
        this.demoteFailure = failure;
    }

    public synchronized void failLagQueriesWith(RuntimeException failure) {
        this.lagFailure = failure;
    }

    public synchronized void failCacheCommandsWith(RuntimeException failure) {
        this.cacheFailure = failure;
    }

    public synchronized void setLagSeconds(long seconds) {
        this.lagSeconds = seconds;
    }

    public synchronized void setLagBytes(String replicaHost, long bytes) {
        lagBytesByReplica.put(replicaHost, bytes);
    }

    public synchronized StoreRole getStoreRole() {
        return storeRole;
    }

    public synchronized boolean isWritesFenced() {
        return writesFenced;
    }

    public synchronized String getFollowedPrimary() {
        return followedPrimary;
    }

    public synchronized String getSlotName() {
        return slotName;
    }

    public synchronized String getCacheFollowing() {
        return cacheFollowing;
    }

    public synchronized Set<String> getReservedSlots() {
        return Set.copyOf(reservedSlots);
    }

    public synchronized List<String> getJournal() {
        return List.copyOf(journal);
    }
}

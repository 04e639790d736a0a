package com.openisp.ha.controller.peer;

import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-peer outcome of a broadcast. A failed peer never aborts delivery to the others.
 */
@Getter
@ToString
public final class PeerBroadcastResult {

    private final List<String> delivered;
    private final Map<String, String> failed;

    public PeerBroadcastResult(List<String> delivered, Map<String, String> failed) {
        this.delivered = List.copyOf(delivered);
        this.failed = Collections.unmodifiableMap(new LinkedHashMap<>(failed));
    }

    public static PeerBroadcastResult empty() {
        return new PeerBroadcastResult(List.of(), Map.of());
    }

    public int getAttempted() {
        return delivered.size() + failed.size();
    }

    public boolean isFullyDelivered() {
        return failed.isEmpty();
    }
}

package com.openisp.ha.controller.replication;

import java.util.Locale;

/**
 * Naming of the physical replication slots a main reserves for its replicas.
 */
public final class ReplicationSlots {

    static final String PREFIX = "replica_";
    private static final int ID_LENGTH = 16;

    private ReplicationSlots() {
    }

    /**
     * Slot name for the server with the given hardware id: {@code replica_} plus the
     * first sixteen characters of the id. Slot names only allow lower-case letters,
     * digits and underscores, so anything else (MAC separators, dashes) is dropped.
     */
    public static String forHardwareId(String hardwareId) {
        String id = hardwareId.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "");
        return PREFIX + (id.length() > ID_LENGTH ? id.substring(0, ID_LENGTH) : id);
    }
}

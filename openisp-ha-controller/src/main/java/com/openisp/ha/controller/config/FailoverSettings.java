package com.openisp.ha.controller.config;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * Tunable timings and thresholds of the failover controller.
 *
 * Every network and replication call carries one of these timeouts so a wedged
 * peer cannot hang the controller.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public final class FailoverSettings {

    public static final long ONE_MEGABYTE = 1024L * 1024L;

    // Monitor
    @Builder.Default
    private final Duration checkInterval = Duration.ofSeconds(30);

    @Builder.Default
    private final Duration failoverThreshold = Duration.ofMinutes(2);

    @Builder.Default
    private final Duration healthCheckTimeout = Duration.ofSeconds(10);

    // Peer and admin calls
    @Builder.Default
    private final Duration peerRequestTimeout = Duration.ofSeconds(30);

    @Builder.Default
    private final int peerPort = 8080;

    // Replication
    @Builder.Default
    private final Duration replicationLagWarning = Duration.ofSeconds(30);

    @Builder.Default
    private final Duration replicationCallTimeout = Duration.ofSeconds(30);

    @Builder.Default
    private final long switchoverMaxLagBytes = ONE_MEGABYTE;

    @Builder.Default
    private final Duration switchoverSettleDelay = Duration.ofSeconds(5);

    @ToString.Exclude
    @Builder.Default
    private final String cacheCredential = "";

    // Dependent services
    @Builder.Default
    private final String authServiceName = "proisp-radius";

    @Builder.Default
    private final Duration serviceRestartTimeout = Duration.ofSeconds(60);

    /**
     * Creates the settings used when nothing is overridden.
     */
    public static FailoverSettings defaults() {
        return FailoverSettings.builder().build();
    }

    /**
     * Validates the settings.
     *
     * @throws IllegalStateException if a value is out of range
     */
    public void validate() {
        requirePositive(checkInterval, "checkInterval");
        requirePositive(failoverThreshold, "failoverThreshold");
        requirePositive(healthCheckTimeout, "healthCheckTimeout");
        requirePositive(peerRequestTimeout, "peerRequestTimeout");
        requirePositive(replicationCallTimeout, "replicationCallTimeout");
        requirePositive(serviceRestartTimeout, "serviceRestartTimeout");
        if (failoverThreshold.compareTo(checkInterval) < 0) {
            throw new IllegalStateException("failoverThreshold must not be shorter than checkInterval");
        }
        if (replicationLagWarning.isNegative()) {
            throw new IllegalStateException("replicationLagWarning must not be negative");
        }
        if (switchoverSettleDelay.isNegative()) {
            throw new IllegalStateException("switchoverSettleDelay must not be negative");
        }
        if (switchoverMaxLagBytes < 0) {
            throw new IllegalStateException("switchoverMaxLagBytes must not be negative");
        }
        if (peerPort <= 0 || peerPort > 65535) {
            throw new IllegalStateException("peerPort must be between 1 and 65535");
        }
        if (authServiceName == null || authServiceName.isBlank()) {
            throw new IllegalStateException("authServiceName must not be blank");
        }
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalStateException(name + " must be positive");
        }
    }
}

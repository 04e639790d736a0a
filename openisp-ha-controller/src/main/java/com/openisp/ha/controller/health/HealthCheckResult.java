package com.openisp.ha.controller.health;

import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of one liveness poll against the main server.
 */
@Getter
@ToString
public final class HealthCheckResult {

    private final boolean healthy;
    private final int statusCode;
    private final String failureReason;

    private HealthCheckResult(boolean healthy, int statusCode, String failureReason) {
        this.healthy = healthy;
        this.statusCode = statusCode;
        this.failureReason = failureReason;
    }

    public static HealthCheckResult healthy() {
        return new HealthCheckResult(true, 200, null);
    }

    public static HealthCheckResult unhealthyStatus(int statusCode) {
        return new HealthCheckResult(false, statusCode, "main server returned status " + statusCode);
    }

    public static HealthCheckResult unreachable(String reason) {
        return new HealthCheckResult(false, -1, "main server unreachable: " + reason);
    }
}

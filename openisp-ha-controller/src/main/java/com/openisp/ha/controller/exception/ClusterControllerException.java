package com.openisp.ha.controller.exception;

import lombok.Getter;

/**
 * Base class of all errors raised by the failover controller.
 */
@Getter
public class ClusterControllerException extends RuntimeException {

    private final ErrorCategory category;

    public ClusterControllerException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }

    public ClusterControllerException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }
}

package com.openisp.ha.controller.exception;

public class ClusterConfigurationException extends ClusterControllerException {

    public ClusterConfigurationException(String message) {
        super(ErrorCategory.CONFIGURATION, message);
    }

    public static ClusterConfigurationException notConfigured() {
        return new ClusterConfigurationException("cluster not configured");
    }
}

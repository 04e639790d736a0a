package com.openisp.ha.controller.exception;

public class ClusterAuthenticationException extends ClusterControllerException {

    public ClusterAuthenticationException() {
        super(ErrorCategory.AUTHENTICATION, "invalid cluster secret");
    }
}

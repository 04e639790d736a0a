package com.openisp.ha.controller.exception;

/**
 * Fatal failure of an orchestration step. The remaining steps are not run.
 */
public class FailoverPipelineException extends ClusterControllerException {

    public FailoverPipelineException(String message, Throwable cause) {
        super(ErrorCategory.FATAL_PIPELINE, message, cause);
    }

    public FailoverPipelineException(String message) {
        super(ErrorCategory.FATAL_PIPELINE, message);
    }
}

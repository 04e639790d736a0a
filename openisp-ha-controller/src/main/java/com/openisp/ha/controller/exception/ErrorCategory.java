package com.openisp.ha.controller.exception;

/**
 * Classes of failure the controller distinguishes when reporting errors.
 */
public enum ErrorCategory {

    /**
     * No cluster, wrong role, missing or offline target. Rejected before any side effect.
     */
    CONFIGURATION,

    /**
     * Cluster secret mismatch on a peer message.
     */
    AUTHENTICATION,

    /**
     * Promotion, demotion or handoff failure that aborts the pipeline.
     */
    FATAL_PIPELINE,

    /**
     * A single peer could not be reached or answered with an error.
     */
    PEER
}

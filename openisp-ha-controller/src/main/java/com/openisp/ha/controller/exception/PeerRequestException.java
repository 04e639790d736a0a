package com.openisp.ha.controller.exception;

import lombok.Getter;

/**
 * A control request to one peer failed, either on the network or with a non-200 answer.
 */
@Getter
public class PeerRequestException extends ClusterControllerException {

    private final String peerAddress;
    private final int statusCode;

    public PeerRequestException(String peerAddress, int statusCode) {
        super(ErrorCategory.PEER, "target node returned status " + statusCode);
        this.peerAddress = peerAddress;
        this.statusCode = statusCode;
    }

    /**
     * A non-200 answer that carried an error message in its body.
     */
    public PeerRequestException(String peerAddress, int statusCode, String message) {
        super(ErrorCategory.PEER, message);
        this.peerAddress = peerAddress;
        this.statusCode = statusCode;
    }

    public PeerRequestException(String peerAddress, Throwable cause) {
        super(ErrorCategory.PEER, "failed to contact " + peerAddress + ": " + describe(cause), cause);
        this.peerAddress = peerAddress;
        this.statusCode = -1;
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}

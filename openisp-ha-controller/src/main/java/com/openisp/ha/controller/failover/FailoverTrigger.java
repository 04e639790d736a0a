package com.openisp.ha.controller.failover;

/**
 * What caused a failover run.
 */
public enum FailoverTrigger {

    /** The monitor saw the main server down for longer than the threshold. */
    AUTOMATIC,

    /** The main server asked this node to take over (manual failover). */
    PEER_PROMOTE,

    /** The main server is handing its role over in a planned switchover. */
    SWITCHOVER
}

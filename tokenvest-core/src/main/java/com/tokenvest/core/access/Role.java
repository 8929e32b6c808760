package com.tokenvest.core.access;

/**
 * Capabilities checked by the vesting engine, the distribution ledger and the token ledger.
 */
public enum Role {
    /** Creates plans, sets trigger times, revokes, writes off debt, reallocates capacity. */
    ADMIN,
    /** Executes direct payouts from the designated pools. */
    SCRIPT,
    /** Contracts allowed to issue grants and to call the distribution ledger. */
    APPROVED_CONTRACT,
    /** Holder may move tokens on the token ledger. */
    DISTRIBUTOR,
    /** Manages role membership. */
    OWNER
}

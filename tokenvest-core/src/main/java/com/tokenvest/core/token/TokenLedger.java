package com.tokenvest.core.token;

import java.math.BigInteger;

/**
 * Token balance ledger consumed by the distribution ledger.
 */
public interface TokenLedger {

    /**
     * Moves {@code amount} from the operator's balance to {@code to}.
     * Only a holder of the distributor capability may call this.
     *
     * @return {@code true} when the transfer took effect
     */
    boolean transfer(String operator, String to, BigInteger amount);

    BigInteger balanceOf(String account);
}

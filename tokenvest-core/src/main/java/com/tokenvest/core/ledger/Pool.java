package com.tokenvest.core.ledger;

import java.math.BigInteger;

/**
 * Point-in-time view of one pool.
 */
public record Pool(PoolLabel label, BigInteger authorizedCapacity, BigInteger usedAmount) {

    public BigInteger availableCapacity() {
        return authorizedCapacity.subtract(usedAmount);
    }

    public boolean isExhausted() {
        return usedAmount.compareTo(authorizedCapacity) >= 0;
    }
}

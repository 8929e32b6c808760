package com.tokenvest.core.vesting;

import java.math.BigInteger;

/**
 * Running totals for one beneficiary across all plans.
 */
public record HolderStat(long grantCount, BigInteger totalGrantedAmount, BigInteger totalClaimedAmount) {

    public static final HolderStat EMPTY = new HolderStat(0, BigInteger.ZERO, BigInteger.ZERO);

    HolderStat withGrant(BigInteger amount) {
        return new HolderStat(grantCount + 1, totalGrantedAmount.add(amount), totalClaimedAmount);
    }

    HolderStat withClaimed(BigInteger amount) {
        return new HolderStat(grantCount, totalGrantedAmount, totalClaimedAmount.add(amount));
    }

    /** Granted but not yet claimed or written off. */
    public BigInteger outstandingAmount() {
        return totalGrantedAmount.subtract(totalClaimedAmount);
    }
}

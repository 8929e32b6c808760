package com.tokenvest.core.vesting;

import java.math.BigInteger;
import java.time.Instant;

/**
 * One allocation to a beneficiary under a plan. {@code claimedAmount} only grows and never
 * exceeds {@code totalAmount}.
 */
public record Grant(BigInteger totalAmount, BigInteger claimedAmount, Instant startDate, String beneficiary) {

    public static Grant issue(BigInteger totalAmount, Instant startDate, String beneficiary) {
        return new Grant(totalAmount, BigInteger.ZERO, startDate, beneficiary);
    }

    public Grant withClaimed(BigInteger newClaimedAmount) {
        if (newClaimedAmount.compareTo(claimedAmount) < 0 || newClaimedAmount.compareTo(totalAmount) > 0) {
            throw new IllegalArgumentException("Claimed amount " + newClaimedAmount
                    + " outside [" + claimedAmount + ", " + totalAmount + "]");
        }
        return new Grant(totalAmount, newClaimedAmount, startDate, beneficiary);
    }

    public BigInteger unclaimedAmount() {
        return totalAmount.subtract(claimedAmount);
    }

    public boolean isFullyClaimed() {
        return claimedAmount.compareTo(totalAmount) >= 0;
    }
}

package com.tokenvest.core.vesting;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;

/**
 * Unlock curve: nothing before the trigger time, the initial slice from the trigger time through
 * the cliff, linear unlock of the remainder between cliff and end, everything from the end on.
 */
final class VestingSchedule {

    static final int BASIS_POINTS = 10_000;

    private static final BigInteger NANOS_PER_SECOND = BigInteger.valueOf(1_000_000_000L);

    private VestingSchedule() {
    }

    static BigInteger initialSlice(BigInteger totalAmount, int initialReleaseBps) {
        return totalAmount.multiply(BigInteger.valueOf(initialReleaseBps))
                .divide(BigInteger.valueOf(BASIS_POINTS));
    }

    /**
     * Amount of {@code totalAmount} unlocked at {@code now} for a plan triggered at {@code triggerTime}.
     * Offsets are compared in nanoseconds as {@link BigInteger}, so no plan window can overflow.
     */
    static BigInteger releasedAmount(VestingPlan plan, Instant triggerTime, BigInteger totalAmount, Instant now) {
        BigInteger elapsed = nanosBetween(triggerTime, now);
        BigInteger cliff = nanos(plan.cliff());
        BigInteger end = nanos(plan.duration());

        if (elapsed.compareTo(end) >= 0) {
            return totalAmount;
        }
        if (elapsed.signum() < 0) {
            return BigInteger.ZERO;
        }
        BigInteger initial = initialSlice(totalAmount, plan.initialReleaseBps());
        if (elapsed.compareTo(cliff) <= 0) {
            return initial;
        }
        BigInteger window = end.subtract(cliff);
        if (window.signum() <= 0) {
            return totalAmount;
        }
        BigInteger remaining = totalAmount.subtract(initial);
        return initial.add(remaining.multiply(elapsed.subtract(cliff)).divide(window));
    }

    private static BigInteger nanos(Duration duration) {
        return BigInteger.valueOf(duration.getSeconds()).multiply(NANOS_PER_SECOND)
                .add(BigInteger.valueOf(duration.getNano()));
    }

    private static BigInteger nanosBetween(Instant from, Instant to) {
        return BigInteger.valueOf(to.getEpochSecond()).subtract(BigInteger.valueOf(from.getEpochSecond()))
                .multiply(NANOS_PER_SECOND)
                .add(BigInteger.valueOf((long) to.getNano() - from.getNano()));
    }
}

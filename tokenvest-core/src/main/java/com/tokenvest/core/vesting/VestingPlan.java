package com.tokenvest.core.vesting;

import com.tokenvest.core.ledger.PoolLabel;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable vesting curve shared by every grant issued under it.
 *
 * @param id                        sequential id, starting at 0
 * @param startDate                 earliest allowed grant start and trigger time
 * @param cliff                     offset from the trigger time before linear unlock starts
 * @param duration                  offset from the trigger time at which everything is unlocked
 * @param revocable                 whether an administrator may revoke grants under this plan
 * @param initialReleaseBps         share unlocked at the trigger time, in basis points
 * @param pool                      pool charged when grants under this plan are released
 */
public record VestingPlan(
        long id,
        Instant startDate,
        Duration cliff,
        Duration duration,
        boolean revocable,
        int initialReleaseBps,
        PoolLabel pool
) {
}

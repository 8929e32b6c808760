package com.tokenvest.core.vesting;

import com.tokenvest.core.error.AuthorizationException;
import com.tokenvest.core.error.CapacityException;
import com.tokenvest.core.error.DependencyFailureException;
import com.tokenvest.core.error.StateException;
import com.tokenvest.core.error.ValidationException;
import com.tokenvest.core.event.VestingEventLog.EventType;
import com.tokenvest.core.ledger.PoolLabel;
import com.tokenvest.core.support.VestingFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;

import static com.tokenvest.core.support.VestingFixture.ADMIN;
import static com.tokenvest.core.support.VestingFixture.ALICE;
import static com.tokenvest.core.support.VestingFixture.BOB;
import static com.tokenvest.core.support.VestingFixture.ENGINE;
import static com.tokenvest.core.support.VestingFixture.STRANGER;
import static com.tokenvest.core.support.VestingFixture.T0;
import static com.tokenvest.core.support.VestingFixture.amount;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VestingEngineTest {

    private VestingFixture fx;
    private VestingEngine engine;

    @BeforeEach
    void setUp() {
        fx = new VestingFixture();
        engine = fx.engine;
    }

    @Nested
    class PlanRegistry {

        @Test
        void plansGetSequentialIdsFromZero() {
            VestingPlan first = fx.standardPlan(true);
            VestingPlan second = fx.standardPlan(false);

            assertThat(first.id()).isZero();
            assertThat(second.id()).isEqualTo(1);
            assertThat(engine.getNextPlanId()).isEqualTo(2);
            assertThat(engine.getPlan(1)).contains(second);
            assertThat(engine.getPlans()).containsExactly(first, second);
        }

        @Test
        void rejectsCliffLongerThanDuration() {
            assertThatThrownBy(() -> engine.createPlan(ADMIN, T0, Duration.ofDays(121), Duration.ofDays(120),
                    true, 0, PoolLabel.SEED))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("exceeds duration");
        }

        @Test
        void rejectsDurationEndingBeyondSupportedTimeRange() {
            assertThatThrownBy(() -> engine.createPlan(ADMIN, T0, Duration.ZERO, Duration.ofSeconds(Long.MAX_VALUE),
                    true, 1_000, PoolLabel.SEED))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("supported time range");
            assertThat(engine.getNextPlanId()).isZero();
        }

        @Test
        void claimsOnPlanSpanningHundredsOfMillionsOfYears() {
            // ~400 million years, past the millisecond range of a long
            Duration duration = Duration.ofSeconds(12_600_000_000_000_000L);
            engine.createPlan(ADMIN, T0, Duration.ZERO, duration, true, 1_000, PoolLabel.SEED);
            engine.setTriggerTime(ADMIN, 0, T0);
            engine.issueGrant(ADMIN, ALICE, T0, amount(1_000), 0);

            fx.clock.set(T0.plusSeconds(10));

            assertThat(engine.previewClaimable(ALICE, 0)).isEqualTo(amount(100));
            assertThat(engine.claim(ALICE, 0)).isEqualTo(amount(100));
        }

        @Test
        void rejectsZeroDuration() {
            assertThatThrownBy(() -> engine.createPlan(ADMIN, T0, Duration.ZERO, Duration.ZERO,
                    true, 0, PoolLabel.SEED))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        void rejectsStartInThePast() {
            fx.clock.advance(Duration.ofSeconds(1));

            assertThatThrownBy(() -> fx.standardPlan(true))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("in the past");
            assertThat(engine.getNextPlanId()).isZero();
        }

        @Test
        void rejectsInitialReleaseAboveOneHundredPercent() {
            assertThatThrownBy(() -> engine.createPlan(ADMIN, T0, Duration.ZERO, Duration.ofDays(1),
                    true, 10_001, PoolLabel.SEED))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        void onlyAdministratorsCreatePlans() {
            assertThatThrownBy(() -> engine.createPlan(STRANGER, T0, Duration.ZERO, Duration.ofDays(1),
                    true, 0, PoolLabel.SEED))
                    .isInstanceOf(AuthorizationException.class);
        }

        @Test
        void createPlanEmitsEvent() {
            fx.standardPlan(true);

            assertThat(fx.eventLog.getEntries(EventType.PLAN_CREATED)).singleElement()
                    .satisfies(e -> assertThat(e.event().detail("pool")).isEqualTo("Seed"));
        }
    }

    @Nested
    class TriggerTimes {

        @Test
        void latestWriteWins() {
            fx.standardPlan(true);
            engine.setTriggerTime(ADMIN, 0, T0.plus(Duration.ofDays(1)));
            engine.setTriggerTime(ADMIN, 0, T0.plus(Duration.ofDays(2)));

            assertThat(engine.getTriggerTime(0)).contains(T0.plus(Duration.ofDays(2)));
            assertThat(fx.eventLog.getEntries(EventType.TRIGGER_TIME_SET)).hasSize(2);
        }

        @Test
        void rejectsTriggerBeforePlanStart() {
            fx.standardPlan(true);

            assertThatThrownBy(() -> engine.setTriggerTime(ADMIN, 0, T0.minusSeconds(1)))
                    .isInstanceOf(ValidationException.class);
            assertThat(engine.getTriggerTime(0)).isEmpty();
        }

        @Test
        void rejectsUnknownPlan() {
            assertThatThrownBy(() -> engine.setTriggerTime(ADMIN, 0, T0))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("Unknown vesting plan");
        }

        @Test
        void claimFailsWhileTriggerTimeUnset() {
            fx.standardPlan(true);
            engine.issueGrant(ADMIN, ALICE, T0, amount(1_000), 0);
            fx.clock.advance(Duration.ofDays(200));

            assertThatThrownBy(() -> engine.claim(ALICE, 0))
                    .isInstanceOf(StateException.class)
                    .hasMessageContaining("Trigger time");
        }
    }

    @Nested
    class GrantIssuance {

        @Test
        void issuingUpdatesHolderStatAndTotalVesting() {
            fx.standardPlan(true);
            engine.issueGrant(ADMIN, ALICE, T0, amount(1_000), 0);
            engine.issueGrant(ENGINE, ALICE, T0.plus(Duration.ofDays(3)), amount(500), 0);

            assertThat(engine.getGrants(ALICE, 0)).extracting(Grant::totalAmount)
                    .containsExactly(amount(1_000), amount(500));
            assertThat(engine.getHolderStat(ALICE))
                    .isEqualTo(new HolderStat(2, amount(1_500), BigInteger.ZERO));
            assertThat(engine.getTotalVestingAmount()).isEqualTo(amount(1_500));
        }

        @Test
        void rejectsNextPlanId() {
            fx.standardPlan(true);

            assertThatThrownBy(() -> engine.issueGrant(ADMIN, ALICE, T0, amount(1_000), 1))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("Unknown vesting plan 1");
        }

        @Test
        void rejectsNonPositiveAmountAndEarlyStart() {
            fx.standardPlan(true);

            assertThatThrownBy(() -> engine.issueGrant(ADMIN, ALICE, T0, BigInteger.ZERO, 0))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> engine.issueGrant(ADMIN, ALICE, T0.minusSeconds(1), amount(1), 0))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> engine.issueGrant(ADMIN, null, T0, amount(1), 0))
                    .isInstanceOf(ValidationException.class);
            assertThat(engine.getTotalVestingAmount()).isZero();
        }

        @Test
        void rejectsUnapprovedCaller() {
            fx.standardPlan(true);

            assertThatThrownBy(() -> engine.issueGrant(STRANGER, ALICE, T0, amount(1), 0))
                    .isInstanceOf(AuthorizationException.class);
        }

        @Test
        void pauseBlocksIssuance() {
            fx.standardPlan(true);
            fx.roles.pause(ADMIN);

            assertThatThrownBy(() -> engine.issueGrant(ADMIN, ALICE, T0, amount(1), 0))
                    .isInstanceOf(StateException.class)
                    .hasMessageContaining("paused");
        }
    }

    @Nested
    class Claims {

        @BeforeEach
        void grant() {
            fx.standardPlan(true);
            engine.setTriggerTime(ADMIN, 0, T0);
            engine.issueGrant(ADMIN, ALICE, T0, amount(1_000), 0);
        }

        @Test
        void paysLinearShareAfterCliffThenRemainderAtEnd() {
            fx.clock.set(T0.plus(Duration.ofDays(75)));
            assertThat(engine.claim(ALICE, 0)).isEqualTo(amount(550));

            fx.clock.set(T0.plus(Duration.ofDays(120)));
            assertThat(engine.claim(ALICE, 0)).isEqualTo(amount(450));

            assertThat(fx.tokens.balanceOf(ALICE)).isEqualTo(amount(1_000));
            assertThat(fx.ledger.getUsedAmount(PoolLabel.SEED)).isEqualTo(amount(1_000));
            assertThat(engine.getHolderStat(ALICE).totalClaimedAmount()).isEqualTo(amount(1_000));
            assertThat(engine.getTotalVestingAmount()).isZero();
            assertThat(fx.eventLog.getEntries(EventType.CLAIMED)).hasSize(2);
            assertThat(fx.eventLog.getEntries(EventType.DISBURSED)).hasSize(2);
        }

        @Test
        void secondClaimAtSameInstantHasNothingToPay() {
            fx.clock.set(T0.plus(Duration.ofDays(75)));
            engine.claim(ALICE, 0);

            assertThat(engine.previewClaimable(ALICE, 0)).isZero();
            assertThatThrownBy(() -> engine.claim(ALICE, 0))
                    .isInstanceOf(StateException.class)
                    .hasMessageContaining("Nothing claimable");
        }

        @Test
        void previewDoesNotCommit() {
            fx.clock.set(T0.plus(Duration.ofDays(75)));

            assertThat(engine.previewClaimable(ALICE, 0)).isEqualTo(amount(550));
            assertThat(engine.getGrants(ALICE, 0).get(0).claimedAmount()).isZero();
        }

        @Test
        void settlesMultipleGrantsInCreationOrder() {
            engine.issueGrant(ADMIN, ALICE, T0, amount(2_000), 0);
            fx.clock.set(T0);

            assertThat(engine.claim(ALICE, 0)).isEqualTo(amount(300));
            assertThat(engine.getGrants(ALICE, 0)).extracting(Grant::claimedAmount)
                    .containsExactly(amount(100), amount(200));
        }

        @Test
        void failsWithoutGrants() {
            fx.clock.set(T0.plus(Duration.ofDays(75)));

            assertThatThrownBy(() -> engine.claim(BOB, 0))
                    .isInstanceOf(StateException.class)
                    .hasMessageContaining("No grants");
        }

        @Test
        void failedTransferRollsBackTheWholeClaim() {
            fx.clock.set(T0.plus(Duration.ofDays(75)));
            fx.tokenLedger.rejectTransfers(true);
            int eventsBefore = fx.eventLog.size();

            assertThatThrownBy(() -> engine.claim(ALICE, 0))
                    .isInstanceOf(DependencyFailureException.class);

            assertThat(engine.getGrants(ALICE, 0).get(0).claimedAmount()).isZero();
            assertThat(engine.getHolderStat(ALICE).totalClaimedAmount()).isZero();
            assertThat(engine.getTotalVestingAmount()).isEqualTo(amount(1_000));
            assertThat(fx.ledger.getUsedAmount(PoolLabel.SEED)).isZero();
            assertThat(fx.eventLog.size()).isEqualTo(eventsBefore);

            fx.tokenLedger.rejectTransfers(false);
            assertThat(engine.claim(ALICE, 0)).isEqualTo(amount(550));
        }

        @Test
        void exhaustedPoolRollsBackTheClaim() {
            engine.createPlan(ADMIN, T0, Duration.ZERO, Duration.ofDays(1), true, 10_000, PoolLabel.SEED);
            engine.setTriggerTime(ADMIN, 1, T0);
            engine.issueGrant(ADMIN, BOB, T0, amount(50_000), 1);
            engine.claim(BOB, 1);
            fx.clock.set(T0.plus(Duration.ofDays(75)));

            assertThatThrownBy(() -> engine.claim(ALICE, 0))
                    .isInstanceOf(CapacityException.class);
            assertThat(engine.getGrants(ALICE, 0).get(0).claimedAmount()).isZero();
        }

        @Test
        void transferCallbackCannotReenterTheEngine() {
            fx.clock.set(T0.plus(Duration.ofDays(75)));
            fx.tokenLedger.onTransfer(() -> engine.claim(ALICE, 0));

            assertThatThrownBy(() -> engine.claim(ALICE, 0))
                    .isInstanceOf(StateException.class)
                    .hasMessageContaining("Reentrant");
            assertThat(engine.getGrants(ALICE, 0).get(0).claimedAmount()).isZero();

            fx.tokenLedger.onTransfer(null);
            assertThat(engine.claim(ALICE, 0)).isEqualTo(amount(550));
        }
    }

    @Nested
    class Revocation {

        @BeforeEach
        void grant() {
            fx.standardPlan(true);
            fx.standardPlan(false);
            engine.setTriggerTime(ADMIN, 0, T0);
            engine.setTriggerTime(ADMIN, 1, T0);
            engine.issueGrant(ADMIN, ALICE, T0, amount(1_000), 0);
            engine.issueGrant(ADMIN, ALICE, T0, amount(1_000), 1);
        }

        @Test
        void releasesVestedPortionThenBlocksClaims() {
            fx.clock.set(T0.plus(Duration.ofDays(75)));

            assertThat(engine.revoke(ADMIN, ALICE, 0)).isEqualTo(amount(550));
            assertThat(engine.isRevoked(ALICE, 0)).isTrue();
            assertThat(fx.tokens.balanceOf(ALICE)).isEqualTo(amount(550));

            fx.clock.set(T0.plus(Duration.ofDays(200)));
            assertThatThrownBy(() -> engine.claim(ALICE, 0))
                    .isInstanceOf(StateException.class)
                    .hasMessageContaining("revoked");
            // forfeited capacity is not handed back to the pool
            assertThat(fx.ledger.getUsedAmount(PoolLabel.SEED)).isEqualTo(amount(550));
        }

        @Test
        void succeedsWithNothingClaimable() {
            fx.clock.set(T0.minusSeconds(1));
            engine.setTriggerTime(ADMIN, 0, T0.plus(Duration.ofDays(10)));

            assertThat(engine.revoke(ADMIN, ALICE, 0)).isZero();
            assertThat(engine.isRevoked(ALICE, 0)).isTrue();
            assertThat(fx.tokenLedger.getTransferCount()).isZero();
        }

        @Test
        void nonRevocablePlanLeavesStateUntouched() {
            fx.clock.set(T0.plus(Duration.ofDays(75)));

            assertThatThrownBy(() -> engine.revoke(ADMIN, ALICE, 1))
                    .isInstanceOf(StateException.class)
                    .hasMessageContaining("not revocable");
            assertThat(engine.isRevoked(ALICE, 1)).isFalse();
            assertThat(engine.getGrants(ALICE, 1).get(0).claimedAmount()).isZero();
            assertThat(engine.getTotalVestingAmount()).isEqualTo(amount(2_000));
        }

        @Test
        void cannotRevokeTwice() {
            engine.revoke(ADMIN, ALICE, 0);

            assertThatThrownBy(() -> engine.revoke(ADMIN, ALICE, 0))
                    .isInstanceOf(StateException.class)
                    .hasMessageContaining("already revoked");
        }

        @Test
        void onlyAdministratorsRevoke() {
            assertThatThrownBy(() -> engine.revoke(ENGINE, ALICE, 0))
                    .isInstanceOf(AuthorizationException.class);
        }
    }

    @Nested
    class DebtWriteOff {

        @BeforeEach
        void grant() {
            fx.standardPlan(true);
            fx.standardPlan(true);
            engine.setTriggerTime(ADMIN, 0, T0);
            engine.issueGrant(ADMIN, ALICE, T0, amount(300), 0);
            engine.issueGrant(ADMIN, ALICE, T0, amount(200), 0);
            engine.issueGrant(ADMIN, ALICE, T0, amount(1_000), 1);
        }

        @Test
        void advancesGrantsInPlanThenCreationOrderWithoutMovingTokens() {
            engine.writeOffDebt(ADMIN, ALICE, amount(700));

            assertThat(engine.getGrants(ALICE, 0)).extracting(Grant::claimedAmount)
                    .containsExactly(amount(300), amount(200));
            assertThat(engine.getGrants(ALICE, 1)).extracting(Grant::claimedAmount)
                    .containsExactly(amount(200));
            assertThat(engine.getHolderStat(ALICE).totalClaimedAmount()).isEqualTo(amount(700));
            assertThat(engine.getTotalVestingAmount()).isEqualTo(amount(800));
            assertThat(fx.tokenLedger.getTransferCount()).isZero();
            assertThat(fx.ledger.getUsedAmount(PoolLabel.SEED)).isZero();
            assertThat(fx.eventLog.getEntries(EventType.PLAN_DEBT_WRITTEN_OFF)).hasSize(2);
            assertThat(fx.eventLog.getEntries(EventType.DEBT_WRITTEN_OFF)).hasSize(1);
        }

        @Test
        void rejectsDebtAboveOutstandingEntitlement() {
            assertThatThrownBy(() -> engine.writeOffDebt(ADMIN, ALICE, amount(1_501)))
                    .isInstanceOf(ValidationException.class);

            assertThat(engine.getGrants(ALICE, 0)).extracting(Grant::claimedAmount)
                    .containsOnly(BigInteger.ZERO);
            assertThat(engine.getGrants(ALICE, 1)).extracting(Grant::claimedAmount)
                    .containsOnly(BigInteger.ZERO);
        }

        @Test
        void skipsRevokedPairsAndRollsBackWhenTheRestCannotAbsorbTheDebt() {
            engine.revoke(ADMIN, ALICE, 1);

            assertThatThrownBy(() -> engine.writeOffDebt(ADMIN, ALICE, amount(600)))
                    .isInstanceOf(StateException.class);
            assertThat(engine.getGrants(ALICE, 0)).extracting(Grant::claimedAmount)
                    .containsOnly(BigInteger.ZERO);

            engine.writeOffDebt(ADMIN, ALICE, amount(500));
            assertThat(engine.getGrants(ALICE, 1).get(0).claimedAmount()).isZero();
        }

        @Test
        void writtenOffAmountIsNoLongerClaimable() {
            engine.writeOffDebt(ENGINE, ALICE, amount(300));
            fx.clock.set(T0.plus(Duration.ofDays(120)));

            assertThat(engine.claim(ALICE, 0)).isEqualTo(amount(200));
        }

        @Test
        void rejectsStrangers() {
            assertThatThrownBy(() -> engine.writeOffDebt(STRANGER, ALICE, amount(1)))
                    .isInstanceOf(AuthorizationException.class);
        }
    }
}

package com.tokenvest.core.vesting;

import com.tokenvest.core.access.CapabilityGate;
import com.tokenvest.core.error.StateException;
import com.tokenvest.core.error.ValidationException;
import com.tokenvest.core.event.VestingEventLog.EventType;
import com.tokenvest.core.event.VestingEventLog.VestingEvent;
import com.tokenvest.core.ledger.DistributionLedger;
import com.tokenvest.core.ledger.PoolLabel;
import com.tokenvest.core.tx.ReentrancyGuard;
import com.tokenvest.core.tx.UnitOfWork;
import com.tokenvest.core.vesting.VestingState.GrantKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Vesting plans, grants and their settlement.
 *
 * <p>Claims, revocations and debt write-offs settle grants in creation order. A release books
 * the claimed amounts and counters first and then asks the {@link DistributionLedger} to pay out;
 * a failed payout rolls back the whole call. Every mutating operation is serialized through the
 * shared {@link UnitOfWork} and rejects re-entry while another one is in progress on this engine.
 */
public class VestingEngine {

    private static final Logger log = LoggerFactory.getLogger(VestingEngine.class);

    private final String address;
    private final CapabilityGate gate;
    private final DistributionLedger ledger;
    private final UnitOfWork unitOfWork;
    private final Clock clock;
    private final ReentrancyGuard guard = new ReentrancyGuard("VestingEngine");
    private final VestingState state;

    /**
     * @param address engine account; must hold the approved-contract role to draw on the ledger
     */
    public VestingEngine(String address,
                         CapabilityGate gate,
                         DistributionLedger ledger,
                         UnitOfWork unitOfWork,
                         Clock clock) {
        if (address == null || address.isBlank()) {
            throw new ValidationException("Engine address cannot be empty");
        }
        this.address = address;
        this.gate = Objects.requireNonNull(gate, "Capability gate cannot be null");
        this.ledger = Objects.requireNonNull(ledger, "Distribution ledger cannot be null");
        this.unitOfWork = Objects.requireNonNull(unitOfWork, "Unit of work cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.state = new VestingState(unitOfWork);
    }

    // ==================== Plan registry ====================

    public VestingPlan createPlan(String caller,
                                  Instant startDate,
                                  Duration cliff,
                                  Duration duration,
                                  boolean revocable,
                                  int initialReleaseBps,
                                  PoolLabel pool) {
        return unitOfWork.execute("createPlan", () -> guard.enter("createPlan", () -> {
            gate.requireAdmin(caller);
            if (startDate == null || cliff == null || duration == null || pool == null) {
                throw new ValidationException("Start date, cliff, duration and pool are required");
            }
            if (duration.isZero() || duration.isNegative()) {
                throw new ValidationException("Duration must be positive");
            }
            if (cliff.isNegative()) {
                throw new ValidationException("Cliff cannot be negative");
            }
            if (cliff.compareTo(duration) > 0) {
                throw new ValidationException("Cliff " + cliff + " exceeds duration " + duration);
            }
            requireRepresentableEnd(startDate, duration);
            if (startDate.isBefore(clock.instant())) {
                throw new ValidationException("Start date " + startDate + " is in the past");
            }
            if (initialReleaseBps < 0 || initialReleaseBps > VestingSchedule.BASIS_POINTS) {
                throw new ValidationException("Initial release must be within 0.."
                        + VestingSchedule.BASIS_POINTS + " basis points");
            }

            VestingPlan plan = state.appendPlan(id -> new VestingPlan(
                    id, startDate, cliff, duration, revocable, initialReleaseBps, pool));
            log.info("Created vesting plan {} on pool {} (cliff {}, duration {}, initial {} bps)",
                    plan.id(), pool.label(), cliff, duration, initialReleaseBps);
            unitOfWork.emit(VestingEvent.of(EventType.PLAN_CREATED)
                    .with("planId", plan.id())
                    .with("startDate", startDate)
                    .with("cliff", cliff)
                    .with("duration", duration)
                    .with("revocable", revocable)
                    .with("initialReleaseBps", initialReleaseBps)
                    .with("pool", pool.label())
                    .build());
            return plan;
        }));
    }

    private static void requireRepresentableEnd(Instant startDate, Duration duration) {
        try {
            startDate.plus(duration);
        } catch (DateTimeException | ArithmeticException e) {
            throw new ValidationException("Duration " + duration + " ends beyond the supported time range");
        }
    }

    // ==================== Trigger-time registry ====================

    /**
     * Anchors the cliff and duration windows of a plan. Later writes replace earlier ones.
     */
    public void setTriggerTime(String caller, long planId, Instant time) {
        unitOfWork.run("setTriggerTime", () -> guard.run("setTriggerTime", () -> {
            gate.requireAdmin(caller);
            VestingPlan plan = requirePlan(planId);
            if (time == null || time.isBefore(plan.startDate())) {
                throw new ValidationException("Trigger time " + time
                        + " precedes plan start " + plan.startDate());
            }
            state.putTriggerTime(planId, time);
            log.info("Trigger time of plan {} set to {}", planId, time);
            unitOfWork.emit(VestingEvent.of(EventType.TRIGGER_TIME_SET)
                    .with("planId", planId)
                    .with("triggerTime", time)
                    .build());
        }));
    }

    // ==================== Grant issuance ====================

    public Grant issueGrant(String caller, String beneficiary, Instant startDate, BigInteger amount, long planId) {
        return unitOfWork.execute("issueGrant", () -> guard.enter("issueGrant", () -> {
            gate.requireAdminOrApprovedContract(caller);
            gate.requireNotPaused();
            requireAccount(beneficiary);
            if (amount == null || amount.signum() <= 0) {
                throw new ValidationException("Grant amount must be positive");
            }
            VestingPlan plan = requirePlan(planId);
            if (startDate == null || startDate.isBefore(plan.startDate())) {
                throw new ValidationException("Grant start " + startDate
                        + " precedes plan start " + plan.startDate());
            }

            Grant grant = Grant.issue(amount, startDate, beneficiary);
            state.appendGrant(new GrantKey(beneficiary, planId), grant);
            state.recordGranted(beneficiary, amount);
            log.info("Issued grant of {} to {} under plan {}", amount, beneficiary, planId);
            unitOfWork.emit(VestingEvent.of(EventType.GRANT_CREATED)
                    .with("beneficiary", beneficiary)
                    .with("planId", planId)
                    .with("amount", amount)
                    .with("startDate", startDate)
                    .with("caller", caller)
                    .build());
            return grant;
        }));
    }

    // ==================== Claim / revoke / debt ====================

    /**
     * Releases everything currently unlocked for the caller under {@code planId}.
     *
     * @return the amount paid out
     */
    public BigInteger claim(String caller, long planId) {
        return unitOfWork.execute("claim", () -> guard.enter("claim", () -> {
            gate.requireNotPaused();
            requireAccount(caller);
            VestingPlan plan = requirePlan(planId);
            GrantKey key = new GrantKey(caller, planId);
            if (state.isRevoked(key)) {
                throw new StateException("Grants of " + caller + " under plan " + planId + " are revoked");
            }

            BigInteger amount = settle(key, plan, requireTriggerTime(plan), true);
            if (amount.signum() == 0) {
                throw new StateException("Nothing claimable for " + caller + " under plan " + planId);
            }
            release(caller, plan, amount);
            unitOfWork.emit(VestingEvent.of(EventType.CLAIMED)
                    .with("beneficiary", caller)
                    .with("planId", planId)
                    .with("amount", amount)
                    .build());
            return amount;
        }));
    }

    /**
     * Settles whatever is unlocked so far, pays it out, and permanently disables further claims
     * for the pair. Amounts not yet unlocked are forfeited; their pool capacity stays authorized.
     *
     * @return the amount paid out during revocation, possibly zero
     */
    public BigInteger revoke(String caller, String beneficiary, long planId) {
        return unitOfWork.execute("revoke", () -> guard.enter("revoke", () -> {
            gate.requireAdmin(caller);
            requireAccount(beneficiary);
            VestingPlan plan = requirePlan(planId);
            if (!plan.revocable()) {
                throw new StateException("Plan " + planId + " is not revocable");
            }
            GrantKey key = new GrantKey(beneficiary, planId);
            if (state.isRevoked(key)) {
                throw new StateException("Grants of " + beneficiary + " under plan " + planId + " already revoked");
            }
            if (state.grants(key).isEmpty()) {
                throw new StateException("No grants for " + beneficiary + " under plan " + planId);
            }

            // before the trigger time nothing has unlocked, so there is nothing to settle
            Optional<Instant> triggerTime = state.triggerTime(planId);
            BigInteger amount = triggerTime.isPresent()
                    ? settle(key, plan, triggerTime.get(), true)
                    : BigInteger.ZERO;
            if (amount.signum() > 0) {
                gate.requireNotPaused();
                release(beneficiary, plan, amount);
            }
            state.markRevoked(key);

            log.info("Revoked grants of {} under plan {}, released {}", beneficiary, planId, amount);
            unitOfWork.emit(VestingEvent.of(EventType.REVOKED)
                    .with("beneficiary", beneficiary)
                    .with("planId", planId)
                    .with("released", amount)
                    .build());
            return amount;
        }));
    }

    /**
     * Marks {@code amount} of the beneficiary's outstanding grants as claimed without moving
     * tokens, walking plans in id order and grants in creation order. Revoked pairs are skipped.
     */
    public void writeOffDebt(String caller, String beneficiary, BigInteger amount) {
        unitOfWork.run("writeOffDebt", () -> guard.run("writeOffDebt", () -> {
            gate.requireAdminOrApprovedContract(caller);
            gate.requireNotPaused();
            requireAccount(beneficiary);
            if (amount == null || amount.signum() <= 0) {
                throw new ValidationException("Debt amount must be positive");
            }
            BigInteger outstanding = state.holderStat(beneficiary).outstandingAmount();
            if (amount.compareTo(outstanding) > 0) {
                throw new ValidationException("Debt " + amount + " exceeds outstanding entitlement "
                        + outstanding + " of " + beneficiary);
            }

            BigInteger remaining = amount;
            long planCount = state.nextPlanId();
            for (long planId = 0; planId < planCount && remaining.signum() > 0; planId++) {
                GrantKey key = new GrantKey(beneficiary, planId);
                if (state.isRevoked(key)) {
                    continue;
                }
                BigInteger appliedToPlan = BigInteger.ZERO;
                List<Grant> grants = state.grants(key);
                for (int i = 0; i < grants.size() && remaining.signum() > 0; i++) {
                    BigInteger take = remaining.min(grants.get(i).unclaimedAmount());
                    if (take.signum() > 0) {
                        state.advanceClaimed(key, i, take);
                        remaining = remaining.subtract(take);
                        appliedToPlan = appliedToPlan.add(take);
                    }
                }
                if (appliedToPlan.signum() > 0) {
                    unitOfWork.emit(VestingEvent.of(EventType.PLAN_DEBT_WRITTEN_OFF)
                            .with("beneficiary", beneficiary)
                            .with("planId", planId)
                            .with("amount", appliedToPlan)
                            .build());
                }
            }
            if (remaining.signum() > 0) {
                throw new StateException("Debt of " + amount + " exceeds the non-revoked entitlement of "
                        + beneficiary + " by " + remaining);
            }

            state.recordClaimed(beneficiary, amount);
            log.info("Wrote off debt of {} for {}", amount, beneficiary);
            unitOfWork.emit(VestingEvent.of(EventType.DEBT_WRITTEN_OFF)
                    .with("beneficiary", beneficiary)
                    .with("amount", amount)
                    .with("caller", caller)
                    .build());
        }));
    }

    /**
     * What {@link #claim} would pay out right now, without committing anything.
     */
    public BigInteger previewClaimable(String beneficiary, long planId) {
        return unitOfWork.query(() -> {
            VestingPlan plan = requirePlan(planId);
            GrantKey key = new GrantKey(beneficiary, planId);
            if (state.isRevoked(key)) {
                return BigInteger.ZERO;
            }
            return settle(key, plan, requireTriggerTime(plan), false);
        });
    }

    // ==================== Reads ====================

    public Optional<VestingPlan> getPlan(long planId) {
        return unitOfWork.query(() -> state.plan(planId));
    }

    public List<VestingPlan> getPlans() {
        return unitOfWork.query(state::plans);
    }

    public long getNextPlanId() {
        return unitOfWork.query(state::nextPlanId);
    }

    public Optional<Instant> getTriggerTime(long planId) {
        return unitOfWork.query(() -> state.triggerTime(planId));
    }

    public List<Grant> getGrants(String beneficiary, long planId) {
        return unitOfWork.query(() -> state.grants(new GrantKey(beneficiary, planId)));
    }

    public HolderStat getHolderStat(String beneficiary) {
        return unitOfWork.query(() -> state.holderStat(beneficiary));
    }

    public BigInteger getTotalVestingAmount() {
        return unitOfWork.query(state::totalVestingAmount);
    }

    public boolean isRevoked(String beneficiary, long planId) {
        return unitOfWork.query(() -> state.isRevoked(new GrantKey(beneficiary, planId)));
    }

    public String getAddress() {
        return address;
    }

    // ==================== Internals ====================

    /**
     * Walks the pair's grants in creation order and sums what each can release on top of its
     * claimed amount. With {@code commit} the claimed amounts are written back in the same pass.
     */
    private BigInteger settle(GrantKey key, VestingPlan plan, Instant triggerTime, boolean commit) {
        List<Grant> grants = state.grants(key);
        if (grants.isEmpty()) {
            throw new StateException("No grants for " + key.beneficiary() + " under plan " + plan.id());
        }
        Instant now = clock.instant();
        BigInteger total = BigInteger.ZERO;
        for (int i = 0; i < grants.size(); i++) {
            Grant grant = grants.get(i);
            if (!key.beneficiary().equals(grant.beneficiary())) {
                throw new StateException("Grant " + i + " of plan " + plan.id()
                        + " does not belong to " + key.beneficiary());
            }
            if (grant.isFullyClaimed()) {
                continue;
            }
            BigInteger released = VestingSchedule.releasedAmount(plan, triggerTime, grant.totalAmount(), now);
            BigInteger available = released.subtract(grant.claimedAmount()).max(BigInteger.ZERO);
            log.debug("Plan {} grant {} of {}: released {}, claimed {}, available {}",
                    plan.id(), i, key.beneficiary(), released, grant.claimedAmount(), available);
            if (available.signum() > 0 && commit) {
                state.advanceClaimed(key, i, available);
            }
            total = total.add(available);
        }
        return total;
    }

    private void release(String beneficiary, VestingPlan plan, BigInteger amount) {
        state.recordClaimed(beneficiary, amount);
        ledger.distribute(address, plan.pool(), amount, beneficiary);
    }

    private VestingPlan requirePlan(long planId) {
        return state.plan(planId)
                .orElseThrow(() -> new ValidationException("Unknown vesting plan " + planId));
    }

    private Instant requireTriggerTime(VestingPlan plan) {
        return state.triggerTime(plan.id())
                .orElseThrow(() -> new StateException("Trigger time of plan " + plan.id() + " is not set"));
    }

    private static void requireAccount(String account) {
        if (account == null || account.isBlank()) {
            throw new ValidationException("Beneficiary address cannot be empty");
        }
    }
}

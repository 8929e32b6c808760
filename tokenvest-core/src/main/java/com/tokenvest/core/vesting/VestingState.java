package com.tokenvest.core.vesting;

import com.tokenvest.core.tx.UnitOfWork;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * State owned by the vesting engine. Every write registers its inverse with the active
 * {@link UnitOfWork} first, so a failed operation leaves no trace.
 */
final class VestingState {

    private final UnitOfWork unitOfWork;

    // append-only arena indexed by plan id
    private final List<VestingPlan> plans = new ArrayList<>();
    private final Map<Long, Instant> triggerTimes = new HashMap<>();
    private final Map<GrantKey, List<Grant>> grants = new HashMap<>();
    private final Map<String, HolderStat> holderStats = new HashMap<>();
    private final Set<GrantKey> revoked = new HashSet<>();
    private BigInteger totalVestingAmount = BigInteger.ZERO;

    VestingState(UnitOfWork unitOfWork) {
        this.unitOfWork = unitOfWork;
    }

    // ==================== Reads ====================

    long nextPlanId() {
        return plans.size();
    }

    Optional<VestingPlan> plan(long planId) {
        if (planId < 0 || planId >= plans.size()) {
            return Optional.empty();
        }
        return Optional.of(plans.get((int) planId));
    }

    List<VestingPlan> plans() {
        return List.copyOf(plans);
    }

    Optional<Instant> triggerTime(long planId) {
        return Optional.ofNullable(triggerTimes.get(planId));
    }

    List<Grant> grants(GrantKey key) {
        List<Grant> list = grants.get(key);
        return list == null ? List.of() : List.copyOf(list);
    }

    HolderStat holderStat(String beneficiary) {
        return holderStats.getOrDefault(beneficiary, HolderStat.EMPTY);
    }

    boolean isRevoked(GrantKey key) {
        return revoked.contains(key);
    }

    BigInteger totalVestingAmount() {
        return totalVestingAmount;
    }

    // ==================== Writes ====================

    VestingPlan appendPlan(PlanFactory factory) {
        VestingPlan plan = factory.create(plans.size());
        unitOfWork.onRollback(() -> plans.remove(plans.size() - 1));
        plans.add(plan);
        return plan;
    }

    void putTriggerTime(long planId, Instant time) {
        Instant previous = triggerTimes.get(planId);
        unitOfWork.onRollback(() -> {
            if (previous == null) {
                triggerTimes.remove(planId);
            } else {
                triggerTimes.put(planId, previous);
            }
        });
        triggerTimes.put(planId, time);
    }

    void appendGrant(GrantKey key, Grant grant) {
        List<Grant> list = grants.computeIfAbsent(key, k -> new ArrayList<>());
        unitOfWork.onRollback(() -> {
            list.remove(list.size() - 1);
            if (list.isEmpty()) {
                grants.remove(key);
            }
        });
        list.add(grant);
    }

    /**
     * Raises the claimed amount of the grant at {@code index} by {@code amount}.
     */
    Grant advanceClaimed(GrantKey key, int index, BigInteger amount) {
        List<Grant> list = grants.get(key);
        Grant before = list.get(index);
        Grant after = before.withClaimed(before.claimedAmount().add(amount));
        unitOfWork.onRollback(() -> list.set(index, before));
        list.set(index, after);
        return after;
    }

    void recordGranted(String beneficiary, BigInteger amount) {
        replaceHolderStat(beneficiary, holderStat(beneficiary).withGrant(amount));
        adjustTotalVesting(amount);
    }

    void recordClaimed(String beneficiary, BigInteger amount) {
        replaceHolderStat(beneficiary, holderStat(beneficiary).withClaimed(amount));
        adjustTotalVesting(amount.negate());
    }

    void markRevoked(GrantKey key) {
        unitOfWork.onRollback(() -> revoked.remove(key));
        revoked.add(key);
    }

    private void replaceHolderStat(String beneficiary, HolderStat stat) {
        HolderStat previous = holderStats.get(beneficiary);
        unitOfWork.onRollback(() -> {
            if (previous == null) {
                holderStats.remove(beneficiary);
            } else {
                holderStats.put(beneficiary, previous);
            }
        });
        holderStats.put(beneficiary, stat);
    }

    private void adjustTotalVesting(BigInteger delta) {
        BigInteger previous = totalVestingAmount;
        unitOfWork.onRollback(() -> totalVestingAmount = previous);
        totalVestingAmount = previous.add(delta);
    }

    @FunctionalInterface
    interface PlanFactory {
        VestingPlan create(long id);
    }

    record GrantKey(String beneficiary, long planId) {
    }
}

package com.tokenvest.core.ledger;

import com.tokenvest.core.access.CapabilityGate;
import com.tokenvest.core.error.CapacityException;
import com.tokenvest.core.error.DependencyFailureException;
import com.tokenvest.core.error.ValidationException;
import com.tokenvest.core.error.VestingException;
import com.tokenvest.core.event.VestingEventLog.EventType;
import com.tokenvest.core.event.VestingEventLog.VestingEvent;
import com.tokenvest.core.token.TokenLedger;
import com.tokenvest.core.tx.ReentrancyGuard;
import com.tokenvest.core.tx.UnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Capacity-checked disbursement bookkeeping per pool.
 *
 * <p>Invariant: {@code usedAmount <= authorizedCapacity} for every pool, and the sum of
 * authorized capacities equals the total supply the ledger was seeded with.
 */
public class DistributionLedger {

    private static final Logger log = LoggerFactory.getLogger(DistributionLedger.class);

    private static final BigInteger BASIS_POINTS = BigInteger.valueOf(10_000);

    /** Pools reachable through {@link #swap} and {@link #transferLiquidity}. */
    public static final Set<PoolLabel> LIQUIDITY_POOLS =
            Collections.unmodifiableSet(EnumSet.of(PoolLabel.GAME_TREASURY, PoolLabel.PLAY_REWARDS));

    /** Source of every capacity reallocation. */
    public static final PoolLabel RESERVE_POOL = PoolLabel.RESERVE;

    private final String address;
    private final CapabilityGate gate;
    private final TokenLedger tokenLedger;
    private final UnitOfWork unitOfWork;
    private final ReentrancyGuard guard = new ReentrancyGuard("DistributionLedger");
    private final Map<PoolLabel, PoolAccount> pools = new EnumMap<>(PoolLabel.class);
    private final BigInteger totalSupply;

    public DistributionLedger(String address,
                              BigInteger totalSupply,
                              Map<PoolLabel, BigInteger> capacities,
                              CapabilityGate gate,
                              TokenLedger tokenLedger,
                              UnitOfWork unitOfWork) {
        if (address == null || address.isBlank()) {
            throw new ValidationException("Ledger address cannot be empty");
        }
        Objects.requireNonNull(totalSupply, "Total supply cannot be null");
        Objects.requireNonNull(capacities, "Capacities cannot be null");
        this.address = address;
        this.totalSupply = totalSupply;
        this.gate = Objects.requireNonNull(gate, "Capability gate cannot be null");
        this.tokenLedger = Objects.requireNonNull(tokenLedger, "Token ledger cannot be null");
        this.unitOfWork = Objects.requireNonNull(unitOfWork, "Unit of work cannot be null");

        BigInteger sum = BigInteger.ZERO;
        for (PoolLabel label : PoolLabel.values()) {
            BigInteger capacity = capacities.get(label);
            if (capacity == null || capacity.signum() < 0) {
                throw new ValidationException("Missing or negative capacity for pool " + label.label());
            }
            pools.put(label, new PoolAccount(capacity));
            sum = sum.add(capacity);
        }
        if (sum.compareTo(totalSupply) != 0) {
            throw new ValidationException(
                    "Pool capacities sum to " + sum + " but total supply is " + totalSupply);
        }
        log.info("Distribution ledger {} seeded with {} pools, total supply {}", address, pools.size(), totalSupply);
    }

    /**
     * Splits {@code totalSupply} by each pool's default share. Rounding dust goes to the reserve.
     */
    public static Map<PoolLabel, BigInteger> defaultAllocation(BigInteger totalSupply) {
        Map<PoolLabel, BigInteger> allocation = new EnumMap<>(PoolLabel.class);
        BigInteger assigned = BigInteger.ZERO;
        for (PoolLabel label : PoolLabel.values()) {
            BigInteger share = totalSupply.multiply(BigInteger.valueOf(label.defaultShareBps())).divide(BASIS_POINTS);
            allocation.put(label, share);
            assigned = assigned.add(share);
        }
        allocation.merge(RESERVE_POOL, totalSupply.subtract(assigned), BigInteger::add);
        return allocation;
    }

    /**
     * Disburses {@code amount} from {@code pool} to {@code to}. Caller must be an approved contract.
     */
    public void distribute(String caller, PoolLabel pool, BigInteger amount, String to) {
        unitOfWork.run("distribute", () -> guard.run("distribute", () -> {
            gate.requireApprovedContract(caller);
            gate.requireNotPaused();
            disburse(pool, amount, to);
            unitOfWork.emit(VestingEvent.of(EventType.DISBURSED)
                    .with("pool", pool.label())
                    .with("amount", amount)
                    .with("to", to)
                    .with("caller", caller)
                    .build());
        }));
    }

    /**
     * Direct payout from one of the {@link #LIQUIDITY_POOLS}, outside any vesting schedule.
     * Caller must hold the script role.
     */
    public void swap(String caller, PoolLabel pool, String to, BigInteger amount) {
        unitOfWork.run("swap", () -> guard.run("swap", () -> {
            gate.requireScript(caller);
            gate.requireNotPaused();
            requireLiquidityPool(pool);
            disburse(pool, amount, to);
            unitOfWork.emit(VestingEvent.of(EventType.SWAPPED)
                    .with("pool", pool.label())
                    .with("amount", amount)
                    .with("to", to)
                    .with("caller", caller)
                    .build());
        }));
    }

    /**
     * Moves unused authorized capacity from the reserve to one of the {@link #LIQUIDITY_POOLS}.
     * No tokens move.
     */
    public void transferLiquidity(String caller, PoolLabel pool, BigInteger amount) {
        unitOfWork.run("transferLiquidity", () -> guard.run("transferLiquidity", () -> {
            gate.requireAdmin(caller);
            requireLiquidityPool(pool);
            requirePositive(amount);

            PoolAccount reserve = pools.get(RESERVE_POOL);
            PoolAccount target = pools.get(pool);
            BigInteger unused = reserve.authorizedCapacity.subtract(reserve.usedAmount);
            if (unused.compareTo(amount) < 0) {
                throw new CapacityException("Reserve has " + unused + " unused capacity, cannot move " + amount);
            }

            BigInteger reserveBefore = reserve.authorizedCapacity;
            BigInteger targetBefore = target.authorizedCapacity;
            unitOfWork.onRollback(() -> {
                reserve.authorizedCapacity = reserveBefore;
                target.authorizedCapacity = targetBefore;
            });
            reserve.authorizedCapacity = reserveBefore.subtract(amount);
            target.authorizedCapacity = targetBefore.add(amount);

            log.info("Reallocated {} capacity from {} to {}", amount, RESERVE_POOL.label(), pool.label());
            unitOfWork.emit(VestingEvent.of(EventType.LIQUIDITY_REALLOCATED)
                    .with("from", RESERVE_POOL.label())
                    .with("to", pool.label())
                    .with("amount", amount)
                    .build());
        }));
    }

    public BigInteger getAuthorizedCapacity(PoolLabel pool) {
        return unitOfWork.query(() -> account(pool).authorizedCapacity);
    }

    public BigInteger getUsedAmount(PoolLabel pool) {
        return unitOfWork.query(() -> account(pool).usedAmount);
    }

    public BigInteger getAvailableCapacity(PoolLabel pool) {
        return getPool(pool).availableCapacity();
    }

    public Pool getPool(PoolLabel pool) {
        return unitOfWork.query(() -> account(pool).view(pool));
    }

    public List<Pool> getPools() {
        return unitOfWork.query(() -> {
            List<Pool> views = new ArrayList<>();
            pools.forEach((label, account) -> views.add(account.view(label)));
            return views;
        });
    }

    public BigInteger getTotalCapacity() {
        return unitOfWork.query(() -> pools.values().stream()
                .map(a -> a.authorizedCapacity)
                .reduce(BigInteger.ZERO, BigInteger::add));
    }

    public BigInteger getTotalSupply() {
        return totalSupply;
    }

    public String getAddress() {
        return address;
    }

    // Capacity check, bookkeeping, then the external transfer.
    private void disburse(PoolLabel pool, BigInteger amount, String to) {
        PoolAccount account = account(pool);
        if (to == null || to.isBlank()) {
            throw new ValidationException("Recipient address cannot be empty");
        }
        if (to.equals(address)) {
            throw new ValidationException("Recipient cannot be the distribution ledger itself");
        }
        requirePositive(amount);

        BigInteger before = account.usedAmount;
        BigInteger after = before.add(amount);
        if (after.compareTo(account.authorizedCapacity) > 0) {
            throw new CapacityException("Pool " + pool.label() + " capacity exceeded: used " + before
                    + " + " + amount + " > " + account.authorizedCapacity);
        }
        unitOfWork.onRollback(() -> account.usedAmount = before);
        account.usedAmount = after;

        boolean transferred;
        try {
            transferred = tokenLedger.transfer(address, to, amount);
        } catch (VestingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DependencyFailureException("Token transfer to " + to + " failed: " + e.getMessage(), e);
        }
        if (!transferred) {
            throw new DependencyFailureException("Token ledger rejected transfer of " + amount + " to " + to);
        }
        log.info("Disbursed {} from {} to {} (used {}/{})", amount, pool.label(), to, after, account.authorizedCapacity);
    }

    private PoolAccount account(PoolLabel pool) {
        if (pool == null) {
            throw new ValidationException("Pool cannot be null");
        }
        return pools.get(pool);
    }

    private static void requireLiquidityPool(PoolLabel pool) {
        if (pool == null || !LIQUIDITY_POOLS.contains(pool)) {
            throw new ValidationException("Pool " + (pool == null ? "null" : pool.label())
                    + " is not a liquidity pool");
        }
    }

    private static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException("Amount must be positive");
        }
    }

    private static final class PoolAccount {
        private BigInteger authorizedCapacity;
        private BigInteger usedAmount = BigInteger.ZERO;

        private PoolAccount(BigInteger authorizedCapacity) {
            this.authorizedCapacity = authorizedCapacity;
        }

        private Pool view(PoolLabel label) {
            return new Pool(label, authorizedCapacity, usedAmount);
        }
    }
}

package com.tokenvest.core.token;

import com.tokenvest.core.access.CapabilityGate;
import com.tokenvest.core.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed-supply token ledger kept in memory. The whole supply is minted to a treasury account
 * at construction; transfers report {@code false} instead of throwing when the operator's balance
 * is short.
 */
public class InMemoryTokenLedger implements TokenLedger {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTokenLedger.class);

    private final CapabilityGate gate;
    private final Map<String, BigInteger> balances = new ConcurrentHashMap<>();
    private final BigInteger totalSupply;

    public InMemoryTokenLedger(CapabilityGate gate, String treasury, BigInteger totalSupply) {
        if (treasury == null || treasury.isBlank()) {
            throw new ValidationException("Treasury address cannot be empty");
        }
        if (totalSupply == null || totalSupply.signum() < 0) {
            throw new ValidationException("Total supply must not be negative");
        }
        this.gate = gate;
        this.totalSupply = totalSupply;
        balances.put(treasury, totalSupply);
    }

    @Override
    public synchronized boolean transfer(String operator, String to, BigInteger amount) {
        gate.requireDistributor(operator);
        if (to == null || amount == null || amount.signum() < 0) {
            return false;
        }
        BigInteger available = balanceOf(operator);
        if (available.compareTo(amount) < 0) {
            log.warn("Transfer of {} from {} rejected: balance {}", amount, operator, available);
            return false;
        }
        balances.put(operator, available.subtract(amount));
        balances.merge(to, amount, BigInteger::add);
        log.debug("Transferred {} from {} to {}", amount, operator, to);
        return true;
    }

    @Override
    public BigInteger balanceOf(String account) {
        if (account == null) {
            return BigInteger.ZERO;
        }
        return balances.getOrDefault(account, BigInteger.ZERO);
    }

    public BigInteger getTotalSupply() {
        return totalSupply;
    }
}

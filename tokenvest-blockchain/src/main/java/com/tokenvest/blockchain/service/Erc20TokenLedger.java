package com.tokenvest.blockchain.service;

import com.tokenvest.blockchain.contract.TokenContract;
import com.tokenvest.blockchain.contract.TokenContract.TransferEvent;
import com.tokenvest.core.access.CapabilityGate;
import com.tokenvest.core.error.DependencyFailureException;
import com.tokenvest.core.token.TokenLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.exceptions.TransactionException;
import org.web3j.protocol.http.HttpService;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Token ledger backed by a deployed ERC-20 contract. The configured key signs every transfer,
 * so the distributor check is the only gate between ledger callers and the chain.
 */
public class Erc20TokenLedger implements TokenLedger {

    private static final Logger log = LoggerFactory.getLogger(Erc20TokenLedger.class);

    private final CapabilityGate gate;
    private final TokenContract contract;

    public Erc20TokenLedger(CapabilityGate gate, TokenContract contract) {
        this.gate = gate;
        this.contract = contract;
    }

    public static Erc20TokenLedger connect(BlockchainConfig config, CapabilityGate gate) {
        if (isBlank(config.getTokenContractAddress()) || isBlank(config.getPrivateKey())) {
            throw new IllegalStateException(
                    "tokenvest.blockchain.token-contract-address and private-key are required when enabled");
        }
        Web3j web3j = Web3j.build(new HttpService(config.getNodeUrl()));
        Credentials credentials = Credentials.create(config.getPrivateKey());
        TokenContract contract = TokenContract.load(
                config.getTokenContractAddress(), web3j, credentials, config.gasProvider());
        log.info("Token contract initialized at {} via {}", config.getTokenContractAddress(), config.getNodeUrl());
        return new Erc20TokenLedger(gate, contract);
    }

    /**
     * Sends the transfer and waits for its receipt. A mined but reverted transfer reports
     * {@code false}; transport errors and receipt timeouts throw {@link DependencyFailureException}.
     */
    @Override
    public boolean transfer(String operator, String to, BigInteger amount) {
        gate.requireDistributor(operator);
        TransactionReceipt receipt;
        try {
            receipt = contract.transfer(to, amount).send();
        } catch (TransactionException e) {
            Optional<TransactionReceipt> reverted = e.getTransactionReceipt().filter(r -> !r.isStatusOK());
            if (reverted.isPresent()) {
                log.warn("Token transfer of {} to {} reverted in tx {}", amount, to,
                        reverted.get().getTransactionHash());
                return false;
            }
            log.error("Token transfer of {} to {} has no receipt", amount, to, e);
            throw new DependencyFailureException("Token transfer to " + to + " failed: " + e.getMessage(), e);
        } catch (Exception e) {
            log.error("Token transfer of {} to {} failed", amount, to, e);
            throw new DependencyFailureException("Token transfer to " + to + " failed: " + e.getMessage(), e);
        }
        List<TransferEvent> events = contract.getTransferEvents(receipt);
        if (events.isEmpty()) {
            log.warn("Transfer of {} to {} in tx {} emitted no Transfer event", amount, to,
                    receipt.getTransactionHash());
        }
        for (TransferEvent event : events) {
            log.info("Transferred {} from {} to {} in tx {}", event.value(), event.from(), event.to(),
                    receipt.getTransactionHash());
        }
        return true;
    }

    @Override
    public BigInteger balanceOf(String account) {
        try {
            return contract.balanceOf(account).send();
        } catch (Exception e) {
            throw new DependencyFailureException("Balance query for " + account + " failed: " + e.getMessage(), e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

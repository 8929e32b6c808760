package com.tokenvest.blockchain.service;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.web3j.tx.gas.StaticGasProvider;

import java.math.BigInteger;

/**
 * Binds {@code tokenvest.blockchain.*}. While {@link #isEnabled()} is false the API keeps token
 * balances in memory and none of the other settings are read.
 */
@Configuration
@ConfigurationProperties(prefix = "tokenvest.blockchain")
public class BlockchainConfig {

    /** JSON-RPC endpoint of the node that relays transfers. */
    private String nodeUrl = "http://localhost:8545";

    /** Deployed ERC-20 the distribution ledger pays out from. */
    private String tokenContractAddress;

    /** Hex key of the account holding the undistributed supply. */
    private String privateKey;

    /** Wei per gas unit. */
    private BigInteger gasPrice = BigInteger.valueOf(20_000_000_000L);

    /** Gas cap per transfer transaction. */
    private BigInteger gasLimit = BigInteger.valueOf(100_000L);

    private boolean enabled;

    StaticGasProvider gasProvider() {
        return new StaticGasProvider(gasPrice, gasLimit);
    }

    public String getNodeUrl() {
        return nodeUrl;
    }

    public void setNodeUrl(String nodeUrl) {
        this.nodeUrl = nodeUrl;
    }

    public String getTokenContractAddress() {
        return tokenContractAddress;
    }

    public void setTokenContractAddress(String tokenContractAddress) {
        this.tokenContractAddress = tokenContractAddress;
    }

    public String getPrivateKey() {
        return privateKey;
    }

    public void setPrivateKey(String privateKey) {
        this.privateKey = privateKey;
    }

    public BigInteger getGasPrice() {
        return gasPrice;
    }

    public void setGasPrice(BigInteger gasPrice) {
        this.gasPrice = gasPrice;
    }

    public BigInteger getGasLimit() {
        return gasLimit;
    }

    public void setGasLimit(BigInteger gasLimit) {
        this.gasLimit = gasLimit;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }
}

package com.tokenvest.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deployment parameters: supply, component accounts, initial role holders and pool capacities.
 * An empty pool map falls back to the default allocation of the total supply.
 */
@Configuration
@ConfigurationProperties(prefix = "tokenvest")
public class TokenvestProperties {

    private BigInteger totalSupply = new BigInteger("1000000000000000000000000000"); // 1e9 tokens, 18 decimals
    private String owner = "0xowner";
    private String engineAddress = "0xvesting-engine";
    private String ledgerAddress = "0xdistribution-ledger";
    private List<String> admins = new ArrayList<>();
    private List<String> scripts = new ArrayList<>();
    private List<String> approvedContracts = new ArrayList<>();
    private Map<String, BigInteger> pools = new LinkedHashMap<>();

    public BigInteger getTotalSupply() { return totalSupply; }
    public void setTotalSupply(BigInteger totalSupply) { this.totalSupply = totalSupply; }
    public String getOwner() { return owner; }
    public void setOwner(String owner) { this.owner = owner; }
    public String getEngineAddress() { return engineAddress; }
    public void setEngineAddress(String engineAddress) { this.engineAddress = engineAddress; }
    public String getLedgerAddress() { return ledgerAddress; }
    public void setLedgerAddress(String ledgerAddress) { this.ledgerAddress = ledgerAddress; }
    public List<String> getAdmins() { return admins; }
    public void setAdmins(List<String> admins) { this.admins = admins; }
    public List<String> getScripts() { return scripts; }
    public void setScripts(List<String> scripts) { this.scripts = scripts; }
    public List<String> getApprovedContracts() { return approvedContracts; }
    public void setApprovedContracts(List<String> approvedContracts) { this.approvedContracts = approvedContracts; }
    public Map<String, BigInteger> getPools() { return pools; }
    public void setPools(Map<String, BigInteger> pools) { this.pools = pools; }
}

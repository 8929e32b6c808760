package com.tokenvest.api.config;

import com.tokenvest.blockchain.service.BlockchainConfig;
import com.tokenvest.blockchain.service.Erc20TokenLedger;
import com.tokenvest.core.access.Role;
import com.tokenvest.core.access.RoleRegistry;
import com.tokenvest.core.event.VestingEventLog;
import com.tokenvest.core.ledger.DistributionLedger;
import com.tokenvest.core.ledger.PoolLabel;
import com.tokenvest.core.token.InMemoryTokenLedger;
import com.tokenvest.core.token.TokenLedger;
import com.tokenvest.core.tx.UnitOfWork;
import com.tokenvest.core.vesting.VestingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;
import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;

/**
 * Wires the engine, the ledger and their shared collaborators from {@link TokenvestProperties}.
 */
@Configuration
public class VestingConfiguration {

    private static final Logger log = LoggerFactory.getLogger(VestingConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public VestingEventLog vestingEventLog(Clock clock, ApplicationEventPublisher publisher) {
        VestingEventLog eventLog = new VestingEventLog(clock);
        eventLog.subscribe(publisher::publishEvent);
        return eventLog;
    }

    @Bean
    public UnitOfWork unitOfWork(VestingEventLog eventLog) {
        return new UnitOfWork(eventLog);
    }

    @Bean
    public RoleRegistry roleRegistry(TokenvestProperties properties) {
        String owner = properties.getOwner();
        RoleRegistry roles = new RoleRegistry(owner);
        properties.getAdmins().forEach(account -> roles.grantRole(owner, Role.ADMIN, account));
        properties.getScripts().forEach(account -> roles.grantRole(owner, Role.SCRIPT, account));
        properties.getApprovedContracts().forEach(account -> roles.grantRole(owner, Role.APPROVED_CONTRACT, account));
        roles.grantRole(owner, Role.APPROVED_CONTRACT, properties.getEngineAddress());
        roles.grantRole(owner, Role.DISTRIBUTOR, properties.getLedgerAddress());
        return roles;
    }

    @Bean
    public TokenLedger tokenLedger(TokenvestProperties properties, BlockchainConfig blockchainConfig,
                                   RoleRegistry roles) {
        if (blockchainConfig.isEnabled()) {
            return Erc20TokenLedger.connect(blockchainConfig, roles);
        }
        log.info("Blockchain disabled; minting {} to {} in memory",
                properties.getTotalSupply(), properties.getLedgerAddress());
        return new InMemoryTokenLedger(roles, properties.getLedgerAddress(), properties.getTotalSupply());
    }

    @Bean
    public DistributionLedger distributionLedger(TokenvestProperties properties, RoleRegistry roles,
                                                 TokenLedger tokenLedger, UnitOfWork unitOfWork) {
        return new DistributionLedger(properties.getLedgerAddress(), properties.getTotalSupply(),
                capacities(properties), roles, tokenLedger, unitOfWork);
    }

    @Bean
    public VestingEngine vestingEngine(TokenvestProperties properties, RoleRegistry roles,
                                       DistributionLedger ledger, UnitOfWork unitOfWork, Clock clock) {
        return new VestingEngine(properties.getEngineAddress(), roles, ledger, unitOfWork, clock);
    }

    static Map<PoolLabel, BigInteger> capacities(TokenvestProperties properties) {
        if (properties.getPools().isEmpty()) {
            return DistributionLedger.defaultAllocation(properties.getTotalSupply());
        }
        Map<PoolLabel, BigInteger> capacities = new EnumMap<>(PoolLabel.class);
        properties.getPools().forEach((key, capacity) -> capacities.put(PoolLabel.fromLabel(key), capacity));
        return capacities;
    }
}

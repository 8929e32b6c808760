package com.tokenvest.blockchain.contract;

import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.RemoteFunctionCall;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.tx.Contract;
import org.web3j.tx.gas.ContractGasProvider;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * ERC-20 token wrapper limited to the calls the distribution ledger makes.
 *
 * Solidity equivalent:
 * interface IERC20 {
 *     function transfer(address to, uint256 amount) external returns (bool);
 *     function balanceOf(address account) external view returns (uint256);
 *     event Transfer(address indexed from, address indexed to, uint256 value);
 * }
 */
public class TokenContract extends Contract {

    /**
     * The token is deployed separately; this wrapper is only ever loaded by address.
     */
    public static final String BINARY = "";

    public static final String FUNC_TRANSFER = "transfer";
    public static final String FUNC_BALANCEOF = "balanceOf";

    public static final Event TRANSFER_EVENT = new Event("Transfer",
            Arrays.asList(
                    new TypeReference<Address>(true) {},  // from
                    new TypeReference<Address>(true) {},  // to
                    new TypeReference<Uint256>() {}       // value
            ));

    protected TokenContract(String contractAddress, Web3j web3j, Credentials credentials,
                            ContractGasProvider gasProvider) {
        super(BINARY, contractAddress, web3j, credentials, gasProvider);
    }

    /**
     * Moves {@code amount} base units from the signing account to {@code to}.
     */
    public RemoteFunctionCall<TransactionReceipt> transfer(String to, BigInteger amount) {
        return executeRemoteCallTransaction(transferFunction(to, amount));
    }

    public RemoteFunctionCall<BigInteger> balanceOf(String account) {
        final Function function = new Function(
                FUNC_BALANCEOF,
                Arrays.asList(new Address(account)),
                Arrays.asList(new TypeReference<Uint256>() {}));
        return executeRemoteCallSingleValueReturn(function, BigInteger.class);
    }

    /**
     * Decodes the {@code Transfer} logs this contract emitted in {@code receipt}.
     */
    public List<TransferEvent> getTransferEvents(TransactionReceipt receipt) {
        if (receipt.getLogs() == null) {
            return Collections.emptyList();
        }
        List<TransferEvent> events = new ArrayList<>();
        for (Contract.EventValuesWithLog values : extractEventParametersWithLog(TRANSFER_EVENT, receipt)) {
            events.add(new TransferEvent(
                    (String) values.getIndexedValues().get(0).getValue(),
                    (String) values.getIndexedValues().get(1).getValue(),
                    (BigInteger) values.getNonIndexedValues().get(0).getValue()));
        }
        return events;
    }

    public static Function transferFunction(String to, BigInteger amount) {
        List<TypeReference<?>> outputs = Collections.singletonList(new TypeReference<Bool>() {});
        return new Function(
                FUNC_TRANSFER,
                Arrays.asList(new Address(to), new Uint256(amount)),
                outputs);
    }

    public static TokenContract load(String contractAddress, Web3j web3j,
                                     Credentials credentials, ContractGasProvider gasProvider) {
        return new TokenContract(contractAddress, web3j, credentials, gasProvider);
    }

    public record TransferEvent(String from, String to, BigInteger value) {}
}

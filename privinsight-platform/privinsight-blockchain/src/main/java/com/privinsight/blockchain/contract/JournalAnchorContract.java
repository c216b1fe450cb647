package com.privinsight.blockchain.contract;

import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.RemoteFunctionCall;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.tx.Contract;
import org.web3j.tx.gas.ContractGasProvider;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;

/**
 * Web3j wrapper for the job journal anchor contract.
 *
 * Stores Merkle roots of journal batches so state transitions and budget
 * commits can be proven against an on-chain record.
 */
public class JournalAnchorContract extends Contract {

    public static final String BINARY = "";
    public static final String FUNC_ANCHORBATCH = "anchorBatch";
    public static final String FUNC_GETBATCHROOT = "getBatchRoot";
    public static final String FUNC_GETBATCHCOUNT = "getBatchCount";

    public static final Event BATCH_ANCHORED_EVENT = new Event("BatchAnchored",
            Arrays.asList(
                    new TypeReference<Uint256>(true) {},  // batchId
                    new TypeReference<Bytes32>() {},      // merkleRoot
                    new TypeReference<Uint256>() {}       // eventCount
            ));

    protected JournalAnchorContract(String contractAddress, Web3j web3j,
                                    Credentials credentials, ContractGasProvider gasProvider) {
        super(BINARY, contractAddress, web3j, credentials, gasProvider);
    }

    public RemoteFunctionCall<TransactionReceipt> anchorBatch(
            byte[] merkleRoot, BigInteger eventCount, byte[] lastEventHash) {
        final Function function = new Function(
                FUNC_ANCHORBATCH,
                Arrays.asList(
                        new Bytes32(merkleRoot),
                        new Uint256(eventCount),
                        new Bytes32(lastEventHash)
                ),
                Collections.emptyList());
        return executeRemoteCallTransaction(function);
    }

    public RemoteFunctionCall<byte[]> getBatchRoot(BigInteger batchId) {
        final Function function = new Function(
                FUNC_GETBATCHROOT,
                Arrays.asList(new Uint256(batchId)),
                Arrays.asList(new TypeReference<Bytes32>() {}));
        return executeRemoteCallSingleValueReturn(function, byte[].class);
    }

    public RemoteFunctionCall<BigInteger> getBatchCount() {
        final Function function = new Function(
                FUNC_GETBATCHCOUNT,
                Collections.emptyList(),
                Arrays.asList(new TypeReference<Uint256>() {}));
        return executeRemoteCallSingleValueReturn(function, BigInteger.class);
    }

    public static JournalAnchorContract load(String contractAddress, Web3j web3j,
                                             Credentials credentials, ContractGasProvider gasProvider) {
        return new JournalAnchorContract(contractAddress, web3j, credentials, gasProvider);
    }
}

package com.privinsight.blockchain.service;

import com.privinsight.blockchain.contract.JournalAnchorContract;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.http.HttpService;
import org.web3j.tx.gas.StaticGasProvider;

import java.math.BigInteger;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Anchors job journal Merkle roots on chain.
 * Every call returns {@link Optional#empty()} while anchoring is disabled or unreachable.
 */
@Service
public class BlockchainJournalAnchorService {

    private static final Logger log = LoggerFactory.getLogger(BlockchainJournalAnchorService.class);

    private final JournalAnchorContract contract;

    public BlockchainJournalAnchorService(BlockchainConfig config) {
        this.contract = connect(config);
    }

    /**
     * Loads the anchor contract, or returns null when anchoring is off or the settings are incomplete.
     */
    private static JournalAnchorContract connect(BlockchainConfig config) {
        if (!config.isEnabled()) {
            return null;
        }
        if (!config.isConfigured()) {
            log.warn("Journal anchoring is enabled but the anchor contract or signer key is missing; anchoring stays off");
            return null;
        }
        try {
            Web3j node = Web3j.build(new HttpService(config.getRpcUrl()));
            JournalAnchorContract loaded = JournalAnchorContract.load(config.getAnchorContract(), node,
                    Credentials.create(config.getSignerKey()),
                    new StaticGasProvider(config.gasPriceWei(), BigInteger.valueOf(config.getAnchorGasLimit())));
            log.info("Anchoring journal roots to {} through {}", config.getAnchorContract(), config.getRpcUrl());
            return loaded;
        } catch (RuntimeException e) {
            log.error("Could not connect to journal anchor contract {}; anchoring stays off",
                    config.getAnchorContract(), e);
            return null;
        }
    }

    /**
     * Anchors the Merkle root of a journal batch.
     */
    public Optional<AnchorResult> anchorBatch(String merkleRoot, int eventCount, String lastEventHash) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        try {
            TransactionReceipt receipt = contract.anchorBatch(
                    toBytes32(merkleRoot), BigInteger.valueOf(eventCount), toBytes32(lastEventHash)).send();

            if (receipt.isStatusOK()) {
                BigInteger batchId = contract.getBatchCount().send().subtract(BigInteger.ONE);
                return Optional.of(new AnchorResult(batchId, receipt.getTransactionHash(),
                        receipt.getBlockNumber(), true));
            }
            log.warn("Journal anchor transaction {} reverted", receipt.getTransactionHash());
            return Optional.of(new AnchorResult(null, receipt.getTransactionHash(), receipt.getBlockNumber(), false));
        } catch (Exception e) {
            log.error("Failed to anchor journal root {} on blockchain", merkleRoot, e);
            return Optional.empty();
        }
    }

    /**
     * Reads an anchored root back, hex encoded.
     */
    public Optional<String> getBatchRoot(BigInteger batchId) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        try {
            return Optional.of(HexFormat.of().formatHex(contract.getBatchRoot(batchId).send()));
        } catch (Exception e) {
            log.error("Failed to read journal batch {} from blockchain", batchId, e);
            return Optional.empty();
        }
    }

    public Optional<BigInteger> getBatchCount() {
        if (!isEnabled()) {
            return Optional.empty();
        }
        try {
            return Optional.of(contract.getBatchCount().send());
        } catch (Exception e) {
            log.error("Failed to get journal batch count from blockchain", e);
            return Optional.empty();
        }
    }

    public boolean isEnabled() {
        return contract != null;
    }

    /**
     * Left-pads a hex string to 32 bytes; longer input is truncated to its first 32 bytes.
     */
    static byte[] toBytes32(String hex) {
        byte[] bytes = new byte[32];
        String cleanHex = hex.startsWith("0x") ? hex.substring(2) : hex;
        if (cleanHex.length() > 64) {
            cleanHex = cleanHex.substring(0, 64);
        }
        if (cleanHex.length() % 2 != 0) {
            cleanHex = "0" + cleanHex;
        }
        byte[] hexBytes = HexFormat.of().parseHex(cleanHex);
        System.arraycopy(hexBytes, 0, bytes, 32 - hexBytes.length, hexBytes.length);
        return bytes;
    }

    public record AnchorResult(BigInteger batchId, String txHash, BigInteger blockNumber, boolean success) {}
}

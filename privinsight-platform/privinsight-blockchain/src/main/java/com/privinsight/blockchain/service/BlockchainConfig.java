package com.privinsight.blockchain.service;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;

/**
 * Connection settings for the journal anchor contract.
 * Anchoring stays off unless {@code enabled} is set and both the contract and signer key are present.
 */
@Configuration
@ConfigurationProperties(prefix = "privinsight.blockchain")
public class BlockchainConfig {

    private static final BigInteger WEI_PER_GWEI = BigInteger.TEN.pow(9);

    private boolean enabled = false;

    /** JSON-RPC endpoint of the node that submits anchor transactions. */
    private String rpcUrl = "http://localhost:8545";

    /** Address of the deployed journal anchor contract. */
    private String anchorContract;

    /** Hex private key of the account paying for anchor transactions. */
    private String signerKey;

    private long gasPriceGwei = 20;

    /** Gas limit for a single anchorBatch call. */
    private long anchorGasLimit = 200_000L;

    public boolean isConfigured() {
        return anchorContract != null && !anchorContract.isBlank()
                && signerKey != null && !signerKey.isBlank();
    }

    public BigInteger gasPriceWei() {
        return BigInteger.valueOf(gasPriceGwei).multiply(WEI_PER_GWEI);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getRpcUrl() {
        return rpcUrl;
    }

    public void setRpcUrl(String rpcUrl) {
        this.rpcUrl = rpcUrl;
    }

    public String getAnchorContract() {
        return anchorContract;
    }

    public void setAnchorContract(String anchorContract) {
        this.anchorContract = anchorContract;
    }

    public String getSignerKey() {
        return signerKey;
    }

    public void setSignerKey(String signerKey) {
        this.signerKey = signerKey;
    }

    public long getGasPriceGwei() {
        return gasPriceGwei;
    }

    public void setGasPriceGwei(long gasPriceGwei) {
        this.gasPriceGwei = gasPriceGwei;
    }

    public long getAnchorGasLimit() {
        return anchorGasLimit;
    }

    public void setAnchorGasLimit(long anchorGasLimit) {
        this.anchorGasLimit = anchorGasLimit;
    }
}

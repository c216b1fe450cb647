package com.privinsight.api.possession;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Configuration for the possession store.
 */
@Configuration
@ConfigurationProperties(prefix = "privinsight.possession")
public class PossessionStoreConfig {

    private long maxDatasetSizeBytes = 32L * 1024 * 1024 * 1024; // 32 GiB
    private Duration challengeTtl = Duration.ofMinutes(10);
    private BigDecimal pricePerGbMonth = new BigDecimal("0.02");

    public long getMaxDatasetSizeBytes() { return maxDatasetSizeBytes; }
    public void setMaxDatasetSizeBytes(long maxDatasetSizeBytes) { this.maxDatasetSizeBytes = maxDatasetSizeBytes; }
    public Duration getChallengeTtl() { return challengeTtl; }
    public void setChallengeTtl(Duration challengeTtl) { this.challengeTtl = challengeTtl; }
    public BigDecimal getPricePerGbMonth() { return pricePerGbMonth; }
    public void setPricePerGbMonth(BigDecimal pricePerGbMonth) { this.pricePerGbMonth = pricePerGbMonth; }
}

package com.privinsight.api.ledger;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Configuration for privacy budget accounting.
 */
@Configuration
@ConfigurationProperties(prefix = "privinsight.ledger")
public class PrivacyLedgerConfig {

    private Duration resetPeriod = Duration.ofDays(30);
    private BigDecimal utilizationWarningThreshold = new BigDecimal("0.80");

    public Duration getResetPeriod() { return resetPeriod; }
    public void setResetPeriod(Duration resetPeriod) { this.resetPeriod = resetPeriod; }
    public BigDecimal getUtilizationWarningThreshold() { return utilizationWarningThreshold; }
    public void setUtilizationWarningThreshold(BigDecimal threshold) { this.utilizationWarningThreshold = threshold; }
}

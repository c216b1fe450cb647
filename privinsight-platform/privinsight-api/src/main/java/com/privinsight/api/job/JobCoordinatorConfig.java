package com.privinsight.api.job;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration for job coordination and background maintenance.
 */
@Configuration
@ConfigurationProperties(prefix = "privinsight.jobs")
public class JobCoordinatorConfig {

    private Duration processingTimeout = Duration.ofMinutes(15);
    private boolean autoFinalize = true;
    private int callbackThreads = 4;
    private int computationThreads = 4;
    private long sweepIntervalMs = 60_000;
    private boolean maintenanceEnabled = true;

    public Duration getProcessingTimeout() { return processingTimeout; }
    public void setProcessingTimeout(Duration processingTimeout) { this.processingTimeout = processingTimeout; }
    public boolean isAutoFinalize() { return autoFinalize; }
    public void setAutoFinalize(boolean autoFinalize) { this.autoFinalize = autoFinalize; }
    public int getCallbackThreads() { return callbackThreads; }
    public void setCallbackThreads(int callbackThreads) { this.callbackThreads = callbackThreads; }
    public int getComputationThreads() { return computationThreads; }
    public void setComputationThreads(int computationThreads) { this.computationThreads = computationThreads; }
    public long getSweepIntervalMs() { return sweepIntervalMs; }
    public void setSweepIntervalMs(long sweepIntervalMs) { this.sweepIntervalMs = sweepIntervalMs; }
    public boolean isMaintenanceEnabled() { return maintenanceEnabled; }
    public void setMaintenanceEnabled(boolean maintenanceEnabled) { this.maintenanceEnabled = maintenanceEnabled; }
}

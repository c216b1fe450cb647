package com.privinsight.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * PrivInsight analytics pipeline.
 *
 * Privacy-governed job coordination: budget admission, compliance gating,
 * proof-of-possession and zero-knowledge result verification.
 */
@SpringBootApplication(scanBasePackages = "com.privinsight")
@EntityScan(basePackages = "com.privinsight.core.domain")
@EnableJpaRepositories(basePackages = "com.privinsight.core.repository")
public class PrivInsightApplication {

    public static void main(String[] args) {
        SpringApplication.run(PrivInsightApplication.class, args);
    }
}

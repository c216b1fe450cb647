package com.privinsight.api.support;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.time.Instant;

@TestConfiguration
public class PipelineTestConfiguration {

    @Bean
    @Primary
    public MutableClock mutableClock() {
        return new MutableClock(Instant.parse("2026-01-05T09:00:00Z"));
    }

    @Bean
    @Primary
    public ScriptedComputationBackend scriptedComputationBackend() {
        return new ScriptedComputationBackend();
    }
}

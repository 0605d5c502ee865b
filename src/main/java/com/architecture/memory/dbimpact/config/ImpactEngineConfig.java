package com.architecture.memory.dbimpact.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Wiring for the impact analysis engine.
 * Limits are read from application.yml; non-positive values fail startup instead of being clamped.
 */
@Configuration
@Slf4j
public class ImpactEngineConfig {

    @Value("${impact.analysis.max-depth}")
    private int maxDepth;

    @Value("${impact.analysis.max-paths}")
    private int maxPaths;

    @Value("${impact.analysis.fetch-timeout-ms:5000}")
    private long fetchTimeoutMs;

    @Bean
    public ImpactAnalysisSettings impactAnalysisSettings() {
        log.info("[Impact Config] maxDepth={}, maxPaths={}, fetchTimeout={}ms", maxDepth, maxPaths, fetchTimeoutMs);
        return new ImpactAnalysisSettings(maxDepth, maxPaths, Duration.ofMillis(fetchTimeoutMs));
    }

    /**
     * Clock used to stamp verdicts.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

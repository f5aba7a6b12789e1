package com.trailledger.activity.config;

import com.trailledger.activity.service.RetryingFetcher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class EngineConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public RetryingFetcher retryingFetcher(TrailLedgerProperties properties) {
        TrailLedgerProperties.Retry retry = properties.getRetry();
        return new RetryingFetcher(retry.getMaxAttempts(), retry.getDefaultDelay(), retry.getSettleDelay());
    }
}

package com.chainwatch.ingestion.config;

import com.chainwatch.common.RetryPolicy;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({ IngestionChainProperties.class, IngestionRetryProperties.class })
public class IngestionConfig {

    @Bean
    public RetryPolicy ingestionRetryPolicy(IngestionRetryProperties retryProperties) {
        return new RetryPolicy(
                retryProperties.getBaseDelayMs(),
                retryProperties.getJitterFactor(),
                retryProperties.getMaxAttempts());
    }
}

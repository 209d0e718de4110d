package com.chainwatch.anomaly.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(AnomalyProperties.class)
public class AnomalyConfig {
}

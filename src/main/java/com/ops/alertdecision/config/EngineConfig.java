package com.ops.alertdecision.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    public AlertSettings alertSettings(AlertDecisionProperties properties) {
        AlertSettings settings = properties.toSettings();
        log.info("Alert decision settings loaded: {}", settings);
        return settings;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

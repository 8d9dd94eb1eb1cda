package com.chainlog.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class AuditConfig {
    @Bean
    public Clock auditClock() {
        return Clock.systemUTC();
    }
}

package com.flagship.loan_ledger.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(LoanEngineProperties.class)
public class LoanEngineConfig {
}

package com.flagship.currency_ledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    @Bean
    public Clock ledgerClock(LedgerProperties properties) {
        return Clock.system(properties.getZone());
    }
}

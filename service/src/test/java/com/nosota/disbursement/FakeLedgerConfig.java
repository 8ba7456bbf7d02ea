package com.nosota.disbursement;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

@TestConfiguration
public class FakeLedgerConfig {

    @Bean
    @Primary
    public FakeLedgerClient fakeLedgerClient() {
        return new FakeLedgerClient();
    }
}

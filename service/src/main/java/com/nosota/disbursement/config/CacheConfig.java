package com.nosota.disbursement.config;

import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Configuration;

/**
 * In-process cache for per-tenant distribution account resolution (Spring's default
 * concurrent map cache manager).
 */
@Configuration
@EnableCaching
public class CacheConfig {

    public static final String DISTRIBUTION_ACCOUNTS_CACHE = "distributionAccounts";
}

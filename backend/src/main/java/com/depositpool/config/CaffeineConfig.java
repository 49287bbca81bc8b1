package com.depositpool.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches for chain lookups.
 * Chain head is shared by every poll in a cycle; a transaction's block number never changes once mined.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String CHAIN_HEAD_CACHE = "chainHeadCache";
    public static final String TX_BLOCK_CACHE = "txBlockCache";

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(CHAIN_HEAD_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(3, TimeUnit.SECONDS)
                .maximumSize(1)
                .build());
        manager.registerCustomCache(TX_BLOCK_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(24, TimeUnit.HOURS)
                .maximumSize(50_000)
                .build());
        return manager;
    }
}

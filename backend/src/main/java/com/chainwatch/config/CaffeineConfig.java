package com.chainwatch.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches for attribution reference data. TTLs stay short because an
 * external loader writes those collections.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String ENTITY_LABEL_CACHE = "entityLabelCache";
    public static final String WATCHLIST_CACHE = "watchlistCache";
    public static final String PROVIDER_WALLET_CACHE = "providerWalletCache";

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(ENTITY_LABEL_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(60, TimeUnit.SECONDS)
                .maximumSize(50_000)
                .build());
        manager.registerCustomCache(WATCHLIST_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(60, TimeUnit.SECONDS)
                .maximumSize(50_000)
                .build());
        manager.registerCustomCache(PROVIDER_WALLET_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(5, TimeUnit.MINUTES)
                .maximumSize(20_000)
                .build());
        return manager;
    }
}

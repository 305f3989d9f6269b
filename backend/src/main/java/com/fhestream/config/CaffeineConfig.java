package com.fhestream.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches in front of Mongo lookups.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String CIPHERTEXT_CACHE = "ciphertextCache";
    public static final String LINEAGE_CACHE = "lineageCache";

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(CIPHERTEXT_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(10, TimeUnit.MINUTES)
                .maximumSize(10_000)
                .build());
        // lineage of a result handle never changes once indexed
        manager.registerCustomCache(LINEAGE_CACHE, Caffeine.newBuilder()
                .expireAfterAccess(1, TimeUnit.HOURS)
                .maximumSize(50_000)
                .build());
        return manager;
    }
}

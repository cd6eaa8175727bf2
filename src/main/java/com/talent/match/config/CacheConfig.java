package com.talent.match.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.talent.match.utils.basic.Constant;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.CacheManager;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * In-process caches for reference data only. Match scores are never cached here: the
 * {@code match_scores} table is the cache and carries its own staleness.
 */
@Configuration
public class CacheConfig {

    @Value("${match.cache.reference-ttl-minutes:10}")
    private long referenceTtlMinutes;

    @Bean
    public CacheManager cacheManager() {
        CaffeineCacheManager caffeineCacheManager =
                new CaffeineCacheManager(Constant.SKILL_MAPPING_CACHE, Constant.ENGINE_CONFIG_CACHE);
        caffeineCacheManager.setCaffeine(Caffeine.newBuilder()
                .expireAfterWrite(referenceTtlMinutes, TimeUnit.MINUTES)
                .maximumSize(10_000)
                .recordStats());
        caffeineCacheManager.setAllowNullValues(false);
        return caffeineCacheManager;
    }
}

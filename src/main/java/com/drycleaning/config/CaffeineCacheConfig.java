package com.drycleaning.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine 로컬 캐시 설정
 *
 * 매장 가격표는 카탈로그 변경 시 명시적으로 무효화하고,
 * TTL은 다른 인스턴스에서 변경된 카탈로그를 따라잡기 위한 상한입니다.
 *
 * 캐시 키: shopId
 */
@Configuration
@EnableCaching
public class CaffeineCacheConfig {

    public static final String SHOP_CATALOG_CACHE = "shopCatalog";
    public static final int CACHE_TTL_SECONDS = 300;
    public static final int CACHE_MAX_SIZE = 500;

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager cacheManager = new CaffeineCacheManager(SHOP_CATALOG_CACHE);
        cacheManager.setCaffeine(Caffeine.newBuilder()
                .expireAfterWrite(CACHE_TTL_SECONDS, TimeUnit.SECONDS)
                .maximumSize(CACHE_MAX_SIZE)
                .recordStats());
        return cacheManager;
    }
}

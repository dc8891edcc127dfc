package com.shophub.global.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.cache.support.SimpleCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 캐시 설정.
 *
 * 리뷰/평점 데이터는 캐시하지 않는다. 평점 집계는 상품 행에 물리화되어 있고
 * 리뷰 상태 변경과 같은 트랜잭션에서 갱신되므로, 캐시를 두면 그 정합성이 깨진다.
 * 인증 사용자 조회만 캐시한다.
 */
@Configuration
@EnableCaching
public class CacheConfig {

    public static final String USER_DETAILS_CACHE = "userDetails";

    @Bean
    public CacheManager cacheManager() {
        SimpleCacheManager cacheManager = new SimpleCacheManager();
        cacheManager.setCaches(List.of(
                // 권한/계정 상태 변경 전파를 빠르게 반영하기 위해 1분.
                cacheMinutes(USER_DETAILS_CACHE, 1, 1000)
        ));
        return cacheManager;
    }

    private CaffeineCache cacheMinutes(String name, int ttlMinutes, long maxSize) {
        return new CaffeineCache(name, Caffeine.newBuilder()
                .expireAfterWrite(ttlMinutes, TimeUnit.MINUTES)
                .maximumSize(maxSize)
                .recordStats()
                .build());
    }
}

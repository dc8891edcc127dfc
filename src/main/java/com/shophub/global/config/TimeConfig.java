package com.shophub.global.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 시간 의존 정책(리뷰 수정 가능 기간 등)을 테스트에서 고정할 수 있도록 Clock을 빈으로 노출한다.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}

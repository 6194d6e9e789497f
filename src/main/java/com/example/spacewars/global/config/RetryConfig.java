package com.example.spacewars.global.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.retry.support.RetryTemplate;

/**
 * Spring Retry 설정
 *
 * - @Retryable 활성화 (배틀 ID 발급 insert)
 * - 플러시 시 엔티티 단건 쓰기를 감싸는 RetryTemplate: 3회, 100ms 고정 간격
 *   3회 모두 실패하면 해당 ID는 dirty로 남아 다음 플러시에서 다시 시도된다.
 */
@Configuration
@EnableRetry
public class RetryConfig {

    public static final int MAX_ATTEMPTS = 3;
    public static final long BACKOFF_MILLIS = 100;

    @Bean
    public RetryTemplate persistenceRetryTemplate() {
        return RetryTemplate.builder()
                .maxAttempts(MAX_ATTEMPTS)
                .fixedBackoff(BACKOFF_MILLIS)
                .retryOn(RuntimeException.class)
                .build();
    }
}

package com.shopflow.order.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shopflow.order.client.ServiceErrorDecoder;
import feign.Request;
import feign.codec.ErrorDecoder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Feign 클라이언트 설정
 *
 * <h3>계단식 타임아웃</h3>
 * <pre>
 * Gateway:          30s (POST /orders, Saga 전체)
 *   └─ TimeLimiter: 2s  (ResilientCaller, 시도 1회당)
 *       └─ Feign:   500ms connect + 1500ms read (가장 안쪽)
 *
 * 호출 1건 최악: 3회 x 2s + 백오프 ≤ 0.9s ≈ 6.9s
 * Saga 최악 (reserve → charge → release): ≈ 21s &lt; 30s
 * </pre>
 * Feign이 먼저 끊겨야 TimeLimiter가 스레드를 버리지 않고 정상 에러로 처리한다.
 */
@Configuration
public class FeignConfig {

    @Bean
    public Request.Options feignRequestOptions() {
        return new Request.Options(
                500, TimeUnit.MILLISECONDS,    // connectTimeout
                1500, TimeUnit.MILLISECONDS,   // readTimeout
                true                    // followRedirects
        );
    }

    @Bean
    public ErrorDecoder serviceErrorDecoder(ObjectMapper objectMapper) {
        return new ServiceErrorDecoder(objectMapper);
    }
}

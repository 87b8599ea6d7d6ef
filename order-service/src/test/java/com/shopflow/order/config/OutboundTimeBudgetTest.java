package com.shopflow.order.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.config.YamlPropertiesFactoryBean;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.core.io.ClassPathResource;

import java.time.Duration;
import java.util.List;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * application.yml의 Resilience4j 설정으로 계산한 최악 소요 시간 검증.
 * Gateway의 order-service TimeLimiter(30s)보다 먼저 Saga가 끝나야 클라이언트가 503을 받고
 * 주문은 뒤늦게 완료되는 상황이 생기지 않는다.
 */
class OutboundTimeBudgetTest {

    private static final Duration GATEWAY_ORDER_TIMEOUT = Duration.ofSeconds(30);
    private static final List<String> TARGETS = List.of("inventory-service", "billing-service");

    private Properties properties;

    @BeforeEach
    void setUp() {
        YamlPropertiesFactoryBean yaml = new YamlPropertiesFactoryBean();
        yaml.setResources(new ClassPathResource("application.yml"));
        properties = yaml.getObject();
    }

    @Test
    @DisplayName("예약 → 결제 → 해제 최악 경로(재시도 + 백오프 포함)가 Gateway 주문 타임아웃 안에 들어옴")
    void worstCaseSaga_FitsGatewayTimeout() {
        // Given
        Duration worstCall = TARGETS.stream()
                .map(this::worstCaseCall)
                .max(Duration::compareTo)
                .orElseThrow();

        // When - 보상까지 가는 경로: reserve, charge, release 세 번의 호출
        Duration worstSaga = worstCall.multipliedBy(3);

        // Then
        assertThat(worstSaga).isLessThan(GATEWAY_ORDER_TIMEOUT);
    }

    private Duration worstCaseCall(String target) {
        Duration perAttempt = DurationStyle.detectAndParse(
                instanceOrDefault("timelimiter", target, "timeout-duration"));
        int attempts = Integer.parseInt(instanceOrDefault("retry", target, "max-attempts"));
        Duration wait = DurationStyle.detectAndParse(instanceOrDefault("retry", target, "wait-duration"));
        double multiplier = Double.parseDouble(instanceOrDefault("retry", target, "exponential-backoff-multiplier"));
        double randomFactor = Double.parseDouble(instanceOrDefault("retry", target, "randomized-wait-factor"));

        double backoffMillis = 0;
        for (int retry = 0; retry < attempts - 1; retry++) {
            backoffMillis += wait.toMillis() * Math.pow(multiplier, retry) * (1 + randomFactor);
        }
        return perAttempt.multipliedBy(attempts).plusMillis((long) Math.ceil(backoffMillis));
    }

    private String instanceOrDefault(String module, String target, String key) {
        String instance = properties.getProperty("resilience4j." + module + ".instances." + target + "." + key);
        if (instance != null) {
            return instance;
        }
        String value = properties.getProperty("resilience4j." + module + ".configs.default." + key);
        assertThat(value).as("resilience4j.%s.configs.default.%s", module, key).isNotNull();
        return value;
    }
}

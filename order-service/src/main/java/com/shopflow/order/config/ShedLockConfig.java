package com.shopflow.order.config;

import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.provider.redis.spring.RedisLockProvider;
import net.javacrumbs.shedlock.spring.annotation.EnableSchedulerLock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;

/**
 * ShedLock 설정 - Redis 기반 스케줄러 분산 락.
 *
 * <p>OutboxRelay와 SagaRecoveryScheduler가 다중 인스턴스에서 동시에 실행되지 않도록 한다.
 * 같은 Saga를 두 인스턴스가 동시에 복구하면 낙관적 락 충돌만 늘어난다.</p>
 */
@Configuration
@EnableSchedulerLock(defaultLockAtMostFor = "30s")
public class ShedLockConfig {

    @Bean
    public LockProvider lockProvider(RedisConnectionFactory connectionFactory) {
        return new RedisLockProvider(connectionFactory, "order-service");
    }
}

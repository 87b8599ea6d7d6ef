package com.shopflow.inventory.config;

import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * JPA 설정.
 *
 * <p>common-outbox의 OutboxConfig가 @EntityScan / @EnableJpaRepositories를 선언하면
 * Spring Boot의 기본 스캔이 꺼지므로, 서비스 자신의 엔티티·리포지토리 패키지도 여기서 명시한다.</p>
 */
@Configuration
@EnableJpaAuditing
@EntityScan("com.shopflow.inventory.entity")
@EnableJpaRepositories("com.shopflow.inventory.repository")
public class JpaConfig {
}

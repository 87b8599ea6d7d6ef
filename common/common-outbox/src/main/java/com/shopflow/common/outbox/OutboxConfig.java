package com.shopflow.common.outbox;

import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Outbox 모듈 구성.
 *
 * <p>common-outbox를 의존성으로 가진 서비스(Order, Billing, Inventory)에
 * {@link OutboxEvent} 엔티티, {@link OutboxEventRepository}, {@link OutboxService},
 * {@link OutboxRelay}를 등록한다.</p>
 *
 * <p>서비스 자신의 엔티티/리포지토리 스캔은 각 서비스의 JpaConfig가 담당한다.
 * 여기서 @EnableJpaRepositories를 선언하면 기본 스캔이 꺼지기 때문이다.</p>
 */
@Configuration
@ComponentScan(basePackages = "com.shopflow.common.outbox")
@EntityScan(basePackages = "com.shopflow.common.outbox")
@EnableJpaRepositories(basePackages = "com.shopflow.common.outbox")
public class OutboxConfig {
}

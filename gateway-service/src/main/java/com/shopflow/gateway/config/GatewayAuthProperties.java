package com.shopflow.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param requireBearer true면 Bearer 토큰 없는 요청을 401로 막는다 (토큰 검증은 하위 서비스 몫)
 */
@ConfigurationProperties(prefix = "gateway.auth")
public record GatewayAuthProperties(boolean requireBearer) {
}

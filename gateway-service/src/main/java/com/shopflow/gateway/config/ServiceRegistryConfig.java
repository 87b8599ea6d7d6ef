package com.shopflow.gateway.config;

import com.shopflow.gateway.registry.DiscoveryServiceRegistry;
import com.shopflow.gateway.registry.ServiceRegistry;
import com.shopflow.gateway.registry.StaticServiceRegistry;
import com.shopflow.gateway.routing.RoutingTable;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.cloud.client.discovery.ReactiveDiscoveryClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 서비스 레지스트리 선택 ({@code gateway.registry.mode})
 *
 * <pre>
 * static (기본)  → StaticServiceRegistry: gateway.routing.services[*].base-address
 * discovery      → DiscoveryServiceRegistry: Spring Cloud ReactiveDiscoveryClient
 * </pre>
 */
@Configuration
public class ServiceRegistryConfig {

    @Bean
    @ConditionalOnProperty(name = "gateway.registry.mode", havingValue = "static", matchIfMissing = true)
    public ServiceRegistry staticServiceRegistry(RoutingTable routingTable) {
        return new StaticServiceRegistry(routingTable);
    }

    @Bean
    @ConditionalOnProperty(name = "gateway.registry.mode", havingValue = "discovery")
    public ServiceRegistry discoveryServiceRegistry(ReactiveDiscoveryClient discoveryClient) {
        return new DiscoveryServiceRegistry(discoveryClient);
    }
}

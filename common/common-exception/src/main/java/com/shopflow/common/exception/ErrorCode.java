package com.shopflow.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * 에러 코드 열거형 (Error Code Enum)
 *
 * <p>Gateway, Order, Billing, Inventory 서비스가 공유하는 에러 코드 정의.
 * 각 에러 코드는 HTTP 상태 코드, 클라이언트에 노출되는 분류 코드(clientCode), 기본 메시지를 가진다.</p>
 *
 * <h3>클라이언트 분류 코드</h3>
 * <ul>
 *   <li><b>invalid-request</b>: 입력값 오류 (400) - Saga까지 도달하지 않음</li>
 *   <li><b>not-found</b>: 대상 리소스 또는 라우트 없음 (404)</li>
 *   <li><b>rejected</b>: 비즈니스 규칙에 의한 거절 (409) - 재고 부족, 잘못된 상태 전이 등</li>
 *   <li><b>unavailable</b>: 하위 서비스 장애, 타임아웃, 서킷 브레이커 OPEN (503)</li>
 *   <li><b>rate-limited</b>: 요청 한도 초과 (429)</li>
 *   <li><b>internal</b>: 정합성 위반 등 내부 오류 (500)</li>
 * </ul>
 *
 * ★ Shared error taxonomy: every code carries its HTTP status and the client-visible category.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // ── Common (공통 에러) ──
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "invalid-request", "Invalid input value"),
    ENTITY_NOT_FOUND(HttpStatus.NOT_FOUND, "not-found", "Entity not found"),
    ROUTE_NOT_FOUND(HttpStatus.NOT_FOUND, "not-found", "No service is registered for this path"),
    SERVICE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "unavailable", "Service temporarily unavailable"),
    DOWNSTREAM_REJECTED(HttpStatus.CONFLICT, "rejected", "Request rejected by downstream service"),
    INVARIANT_VIOLATION(HttpStatus.INTERNAL_SERVER_ERROR, "internal", "Cross-service consistency violation"),

    // ── Resilience4j 트래픽 제어 ──
    RATE_LIMIT_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS, "rate-limited", "Rate limit exceeded. Please try again later"),
    BULKHEAD_FULL(HttpStatus.SERVICE_UNAVAILABLE, "unavailable", "Too many concurrent requests. Please try again later"),
    CIRCUIT_BREAKER_OPEN(HttpStatus.SERVICE_UNAVAILABLE, "unavailable", "Service circuit breaker is open"),
    REQUEST_TIMEOUT(HttpStatus.SERVICE_UNAVAILABLE, "unavailable", "Request timed out"),

    // ── Order (주문 도메인) ──
    ORDER_NOT_FOUND(HttpStatus.NOT_FOUND, "not-found", "Order not found"),
    INVALID_ORDER_STATUS(HttpStatus.CONFLICT, "rejected", "Invalid order status transition"),

    // ── Inventory (재고 도메인) ──
    SKU_NOT_FOUND(HttpStatus.NOT_FOUND, "not-found", "SKU not found"),
    UNKNOWN_SKU(HttpStatus.CONFLICT, "rejected", "Unknown SKU in reservation"),
    INSUFFICIENT_STOCK(HttpStatus.CONFLICT, "rejected", "Insufficient stock"),
    RESERVATION_NOT_FOUND(HttpStatus.NOT_FOUND, "not-found", "Reservation not found"),
    RESERVATION_RELEASED(HttpStatus.CONFLICT, "rejected", "Reservation for this order was already released"),

    // ── Billing (결제 도메인) ──
    INVALID_CHARGE_AMOUNT(HttpStatus.BAD_REQUEST, "invalid-request", "Charge amount must be positive with at most 2 fraction digits");

    private final HttpStatus status;   // HTTP 응답 상태 코드
    private final String clientCode;   // 클라이언트에 노출되는 분류 코드
    private final String message;      // 기본 에러 메시지
}

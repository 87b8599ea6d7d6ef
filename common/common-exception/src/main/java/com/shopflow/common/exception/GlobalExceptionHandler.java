package com.shopflow.common.exception;

import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * 전역 예외 처리기 (Global Exception Handler)
 *
 * <p>Order, Billing, Inventory 서비스가 공유하는 중앙 집중식 예외 처리.
 * 모든 에러를 RFC 7807 ProblemDetail 형식 + {@code code} 속성으로 통일한다.</p>
 *
 * <h3>처리하는 예외 유형</h3>
 * <ol>
 *   <li><b>BusinessException</b>: 도메인 규칙 위반 → ErrorCode의 상태 코드</li>
 *   <li><b>요청 검증 실패</b>: Bean Validation, 역직렬화 실패, 파라미터 누락 → 400 invalid-request</li>
 *   <li><b>DependencyUnavailableException</b>: 하위 서비스 호출 불가 → 503 unavailable</li>
 *   <li><b>InvariantViolationException</b>: 정합성 위반 → 500 internal</li>
 *   <li><b>Resilience4j 예외</b>: RateLimiter 429, Bulkhead/CircuitBreaker/TimeLimiter 503</li>
 * </ol>
 *
 * <p>응답 본문에는 스택 트레이스나 하위 서비스 주소가 포함되지 않는다.</p>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ProblemDetail> handleBusinessException(BusinessException e) {
        ErrorCode errorCode = e.getErrorCode();
        log.warn("Business exception: code={}, message={}", errorCode, e.getMessage());
        return respond(errorCode, e.getMessage());
    }

    /** @Valid 요청 본문 검증 실패 - 필드별 메시지를 detail에 모은다 */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleValidation(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(this::describe)
                .collect(Collectors.joining(", "));
        return respond(ErrorCode.INVALID_INPUT, detail.isEmpty() ? ErrorCode.INVALID_INPUT.getMessage() : detail);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemDetail> handleUnreadable(HttpMessageNotReadableException e) {
        log.debug("Unreadable request body: {}", e.getMessage());
        return respond(ErrorCode.INVALID_INPUT, "Malformed request body");
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ProblemDetail> handleBadParameter(Exception e) {
        return respond(ErrorCode.INVALID_INPUT, e.getMessage());
    }

    @ExceptionHandler(DependencyUnavailableException.class)
    public ResponseEntity<ProblemDetail> handleDependencyUnavailable(DependencyUnavailableException e) {
        log.warn("Dependency unavailable: target={}, reason={}", e.getTarget(), e.getMessage());
        return respond(ErrorCode.SERVICE_UNAVAILABLE,
                "Dependency " + e.getTarget() + " is temporarily unavailable");
    }

    @ExceptionHandler(InvariantViolationException.class)
    public ResponseEntity<ProblemDetail> handleInvariantViolation(InvariantViolationException e) {
        log.error("CONSISTENCY ALERT: {}", e.getMessage(), e);
        return respond(ErrorCode.INVARIANT_VIOLATION, ErrorCode.INVARIANT_VIOLATION.getMessage());
    }

    // ★ Resilience4j 예외 (서비스 레벨 @RateLimiter 등)

    @ExceptionHandler(RequestNotPermitted.class)
    public ResponseEntity<ProblemDetail> handleRateLimitExceeded(RequestNotPermitted e) {
        log.warn("Rate limit exceeded: {}", e.getMessage());
        return respond(ErrorCode.RATE_LIMIT_EXCEEDED, ErrorCode.RATE_LIMIT_EXCEEDED.getMessage());
    }

    @ExceptionHandler(BulkheadFullException.class)
    public ResponseEntity<ProblemDetail> handleBulkheadFull(BulkheadFullException e) {
        log.warn("Bulkhead full: {}", e.getMessage());
        return respond(ErrorCode.BULKHEAD_FULL, ErrorCode.BULKHEAD_FULL.getMessage());
    }

    @ExceptionHandler(CallNotPermittedException.class)
    public ResponseEntity<ProblemDetail> handleCircuitBreakerOpen(CallNotPermittedException e) {
        log.warn("Circuit breaker open: {}", e.getMessage());
        return respond(ErrorCode.CIRCUIT_BREAKER_OPEN, ErrorCode.CIRCUIT_BREAKER_OPEN.getMessage());
    }

    @ExceptionHandler(TimeoutException.class)
    public ResponseEntity<ProblemDetail> handleTimeout(TimeoutException e) {
        log.warn("Request timeout: {}", e.getMessage());
        return respond(ErrorCode.REQUEST_TIMEOUT, ErrorCode.REQUEST_TIMEOUT.getMessage());
    }

    private ResponseEntity<ProblemDetail> respond(ErrorCode errorCode, String detail) {
        return ResponseEntity.status(errorCode.getStatus())
                .body(ProblemDetails.of(errorCode, detail));
    }

    private String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }
}

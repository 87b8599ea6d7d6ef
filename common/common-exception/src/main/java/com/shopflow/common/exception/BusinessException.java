package com.shopflow.common.exception;

import lombok.Getter;

/**
 * 비즈니스 예외 (Business Exception)
 *
 * <p>도메인 규칙 위반 시 발생하는 unchecked 예외.
 * ErrorCode와 결합하여 HTTP 상태 코드와 에러 메시지를 함께 전달한다.</p>
 *
 * <h3>사용 예시</h3>
 * <pre>
 *   throw new BusinessException(ErrorCode.ORDER_NOT_FOUND);
 *   throw new BusinessException(ErrorCode.INSUFFICIENT_STOCK, "sku=SKU-1 requested=3 available=1");
 * </pre>
 *
 * <p>Resilience Wrapper는 이 예외를 재시도하지 않고 서킷 브레이커 실패로도 집계하지 않는다.
 * 하위 서비스의 4xx 응답도 이 예외로 변환되어 같은 규칙을 따른다.</p>
 */
@Getter
public class BusinessException extends RuntimeException {

    /** 에러 코드 (HTTP 상태 코드 + 분류 코드 + 메시지) */
    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}

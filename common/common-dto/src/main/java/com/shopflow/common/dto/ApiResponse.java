package com.shopflow.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 공통 API 응답 래퍼 (Common API Response Wrapper)
 *
 * <p>모든 서비스의 성공 응답이 같은 형식을 사용하도록 강제하는 공통 DTO.
 * 실패 응답은 ProblemDetail(RFC 7807)로 반환되므로 {@link #error(String)}는
 * Gateway Fallback 등 ProblemDetail을 쓸 수 없는 곳에서만 사용한다.</p>
 *
 * <pre>
 *   // 성공: {"success": true, "data": {...}}
 *   return ApiResponse.ok(orderResponse);
 * </pre>
 *
 * @param <T> 응답 데이터의 타입
 */
@JsonInclude(JsonInclude.Include.NON_NULL) // null 필드는 JSON에서 제외
public record ApiResponse<T>(
        boolean success, // 요청 성공 여부
        T data,          // 성공 시 응답 데이터
        String message   // 실패 시 에러 메시지
) {
    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null);
    }

    public static <T> ApiResponse<T> error(String message) {
        return new ApiResponse<>(false, null, message);
    }
}

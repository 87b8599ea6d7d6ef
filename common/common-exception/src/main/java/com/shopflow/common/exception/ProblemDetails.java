package com.shopflow.common.exception;

import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;

import java.net.URI;

/**
 * RFC 7807 ProblemDetail 생성 헬퍼.
 *
 * <p>서블릿 서비스의 {@link GlobalExceptionHandler}와 리액티브 Gateway의 에러 핸들러가
 * 같은 응답 형식을 쓰도록 한 곳에서 생성한다.</p>
 *
 * <pre>
 *   {
 *     "type": "https://shopflow.dev/errors/rejected",
 *     "title": "Conflict",
 *     "status": 409,
 *     "detail": "Insufficient stock: sku=SKU-1",
 *     "code": "rejected"
 *   }
 * </pre>
 */
public final class ProblemDetails {

    public static final String TYPE_PREFIX = "https://shopflow.dev/errors/";

    private ProblemDetails() {
    }

    public static ProblemDetail of(ErrorCode errorCode, String detail) {
        return of(errorCode.getStatus(), errorCode.getClientCode(), detail);
    }

    public static ProblemDetail of(HttpStatusCode status, String clientCode, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(URI.create(TYPE_PREFIX + clientCode));
        problem.setProperty("code", clientCode);
        return problem;
    }
}

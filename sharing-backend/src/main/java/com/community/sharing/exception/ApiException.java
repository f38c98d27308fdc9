package com.community.sharing.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 业务异常基类：携带 HTTP 状态码与错误标题，由 GlobalExceptionHandler 统一转换为响应。
 */
@Getter
public abstract class ApiException extends RuntimeException {

    private final HttpStatus status;

    /**
     * 错误标题，对应响应体中的 error 字段
     */
    private final String error;

    protected ApiException(HttpStatus status, String error, String message) {
        super(message != null ? message : error);
        this.status = status;
        this.error = error;
    }

    /**
     * 附加说明，没有时返回 null（响应体中省略 message 字段）。
     */
    public String getDetail() {
        String message = getMessage();
        return error.equals(message) ? null : message;
    }
}

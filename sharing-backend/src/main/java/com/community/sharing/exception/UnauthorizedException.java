package com.community.sharing.exception;

import org.springframework.http.HttpStatus;

/**
 * 令牌缺失、格式错误、签名错误或已过期 (401)。
 */
public class UnauthorizedException extends ApiException {

    public UnauthorizedException(String error) {
        super(HttpStatus.UNAUTHORIZED, error, null);
    }

    public UnauthorizedException(String error, String message) {
        super(HttpStatus.UNAUTHORIZED, error, message);
    }
}

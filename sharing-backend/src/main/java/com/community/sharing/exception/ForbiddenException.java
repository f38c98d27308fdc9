package com.community.sharing.exception;

import org.springframework.http.HttpStatus;

/**
 * 已认证但不是资源所有者 (403)。
 */
public class ForbiddenException extends ApiException {

    public ForbiddenException(String error) {
        super(HttpStatus.FORBIDDEN, error, null);
    }

    public ForbiddenException(String error, String message) {
        super(HttpStatus.FORBIDDEN, error, message);
    }
}

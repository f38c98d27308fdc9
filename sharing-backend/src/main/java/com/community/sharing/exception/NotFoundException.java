package com.community.sharing.exception;

import org.springframework.http.HttpStatus;

/**
 * 引用的资源不存在 (404)。
 */
public class NotFoundException extends ApiException {

    public NotFoundException(String error) {
        super(HttpStatus.NOT_FOUND, error, null);
    }

    public NotFoundException(String error, String message) {
        super(HttpStatus.NOT_FOUND, error, message);
    }
}

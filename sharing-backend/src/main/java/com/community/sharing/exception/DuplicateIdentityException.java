package com.community.sharing.exception;

import org.springframework.http.HttpStatus;

/**
 * 唯一性冲突：用户名或邮箱已被注册 (400)。
 */
public class DuplicateIdentityException extends ApiException {

    public DuplicateIdentityException(String error) {
        super(HttpStatus.BAD_REQUEST, error, null);
    }

    public DuplicateIdentityException(String error, String message) {
        super(HttpStatus.BAD_REQUEST, error, message);
    }
}

package com.community.sharing.exception;

import org.springframework.http.HttpStatus;

/**
 * 登录失败：账号不存在或密码错误 (401)。
 */
public class InvalidCredentialsException extends ApiException {

    public InvalidCredentialsException(String error) {
        super(HttpStatus.UNAUTHORIZED, error, null);
    }

    public InvalidCredentialsException(String error, String message) {
        super(HttpStatus.UNAUTHORIZED, error, message);
    }
}

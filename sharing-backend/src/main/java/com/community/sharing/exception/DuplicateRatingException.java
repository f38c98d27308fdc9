package com.community.sharing.exception;

import org.springframework.http.HttpStatus;

/**
 * 同一账号对同一内容重复评分 (400)。
 */
public class DuplicateRatingException extends ApiException {

    public DuplicateRatingException(String error) {
        super(HttpStatus.BAD_REQUEST, error, null);
    }

    public DuplicateRatingException(String error, String message) {
        super(HttpStatus.BAD_REQUEST, error, message);
    }
}

package com.community.sharing.exception;

import java.util.Map;

/**
 * 更新请求未提供任何字段。
 */
public class EmptyUpdateException extends ValidationFailedException {

    public static final String MESSAGE = "At least one field must be provided for update";

    public EmptyUpdateException() {
        super(Map.of(SCHEMA_KEY, MESSAGE));
    }
}

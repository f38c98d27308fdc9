package com.community.sharing.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 输入校验失败 (400)，messages 为 字段 → 原因 的映射。
 */
@Getter
public class ValidationFailedException extends ApiException {

    /**
     * 与具体字段无关的整体错误（如空的更新请求）使用的键
     */
    public static final String SCHEMA_KEY = "_schema";

    private final Map<String, String> messages;

    public ValidationFailedException(Map<String, String> messages) {
        super(HttpStatus.BAD_REQUEST, "Validation failed", null);
        this.messages = Collections.unmodifiableMap(new LinkedHashMap<>(messages));
    }

    public static ValidationFailedException of(String field, String message) {
        return new ValidationFailedException(Map.of(field, message));
    }
}

package com.community.sharing.validation;

import com.community.sharing.exception.ValidationFailedException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一次校验过程中收集的字段错误；同一字段只保留第一条。
 */
public class FieldErrors {

    private final Map<String, String> errors = new LinkedHashMap<>();

    public void reject(String field, String message) {
        errors.putIfAbsent(field, message);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasError(String field) {
        return errors.containsKey(field);
    }

    public Map<String, String> asMap() {
        return new LinkedHashMap<>(errors);
    }

    public void throwIfAny() {
        if (hasErrors()) {
            throw new ValidationFailedException(errors);
        }
    }
}

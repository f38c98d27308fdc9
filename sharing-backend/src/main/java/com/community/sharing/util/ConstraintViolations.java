package com.community.sharing.util;

import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.Locale;

/**
 * 从 flush 时的 DataIntegrityViolationException 中识别被违反的约束。
 * 优先使用 Hibernate 解析出的约束名，解析不到时退回到数据库错误信息。
 */
public final class ConstraintViolations {

    private ConstraintViolations() {
    }

    public static boolean violates(DataIntegrityViolationException e, String constraintName) {
        String expected = constraintName.toLowerCase(Locale.ROOT);
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException) {
                String name = ((ConstraintViolationException) cause).getConstraintName();
                if (name != null && name.toLowerCase(Locale.ROOT).contains(expected)) {
                    return true;
                }
            }
            String message = cause.getMessage();
            if (message != null && message.toLowerCase(Locale.ROOT).contains(expected)) {
                return true;
            }
        }
        return false;
    }
}

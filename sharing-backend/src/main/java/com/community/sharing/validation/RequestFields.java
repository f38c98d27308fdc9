package com.community.sharing.validation;

import com.community.sharing.exception.ValidationFailedException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * 从 JSON 请求体 (Map) 中按类型读取字段的工具方法，错误写入 FieldErrors。
 */
final class RequestFields {

    static final String MISSING = "Missing data for required field.";
    static final String NULL_VALUE = "Field may not be null.";
    static final String NOT_STRING = "Not a valid string.";
    static final String NOT_INTEGER = "Not a valid integer.";
    static final String NOT_EMAIL = "Not a valid email address.";
    static final String NOT_URL = "Not a valid URL.";
    static final String NOT_UUID = "Not a valid UUID.";
    static final String UNKNOWN = "Unknown field.";

    private static final Pattern EMAIL = Pattern.compile(
            "^[A-Za-z0-9.!#$%&'*+/=?^_`{|}~-]+@[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?"
                    + "(?:\\.[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?)+$");

    private static final Set<String> URL_SCHEMES = Set.of("http", "https", "ftp", "ftps");

    private RequestFields() {
    }

    static Map<String, Object> requireBody(Map<String, Object> body) {
        if (body == null) {
            throw ValidationFailedException.of(ValidationFailedException.SCHEMA_KEY, "No input data provided.");
        }
        return body;
    }

    static void rejectUnknown(Map<String, Object> body, Set<String> allowed, FieldErrors errors) {
        body.keySet().stream()
                .filter(field -> !allowed.contains(field))
                .forEach(field -> errors.reject(field, UNKNOWN));
    }

    /**
     * 读取字符串字段。字段缺失时返回 null；required 时记录缺失错误，
     * 显式 null 只有 nullable 时才被接受。
     */
    static String string(Map<String, Object> body, String field, boolean required, boolean nullable,
                         FieldErrors errors) {
        if (!body.containsKey(field)) {
            if (required) {
                errors.reject(field, MISSING);
            }
            return null;
        }
        Object value = body.get(field);
        if (value == null) {
            if (!nullable) {
                errors.reject(field, NULL_VALUE);
            }
            return null;
        }
        if (!(value instanceof String)) {
            errors.reject(field, NOT_STRING);
            return null;
        }
        return (String) value;
    }

    static Integer integer(Map<String, Object> body, String field, boolean required, FieldErrors errors) {
        if (!body.containsKey(field)) {
            if (required) {
                errors.reject(field, MISSING);
            }
            return null;
        }
        Object value = body.get(field);
        if (value == null) {
            errors.reject(field, NULL_VALUE);
            return null;
        }
        Integer parsed = toInteger(value);
        if (parsed == null) {
            errors.reject(field, NOT_INTEGER);
        }
        return parsed;
    }

    static Integer toInteger(Object value) {
        if (value instanceof Integer) {
            return (Integer) value;
        }
        if (value instanceof Long || value instanceof BigInteger) {
            BigInteger big = new BigInteger(value.toString());
            return big.bitLength() < 32 ? big.intValue() : null;
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            try {
                return new BigDecimal(value.toString()).intValueExact();
            } catch (ArithmeticException | NumberFormatException e) {
                return null;
            }
        }
        if (value instanceof String) {
            try {
                return Integer.valueOf(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    static UUID toUuid(String value) {
        try {
            return UUID.fromString(value.trim());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    static void checkLength(String field, String value, Integer min, Integer max, FieldErrors errors) {
        if (value == null) {
            return;
        }
        int length = value.length();
        boolean tooShort = min != null && length < min;
        boolean tooLong = max != null && length > max;
        if (!tooShort && !tooLong) {
            return;
        }
        if (min != null && max != null) {
            errors.reject(field, "Length must be between " + min + " and " + max + ".");
        } else if (tooShort) {
            errors.reject(field, "Shorter than minimum length " + min + ".");
        } else {
            errors.reject(field, "Longer than maximum length " + max + ".");
        }
    }

    static boolean isEmail(String value) {
        return EMAIL.matcher(value).matches();
    }

    static boolean isUrl(String value) {
        if (value.isEmpty() || value.chars().anyMatch(Character::isWhitespace)) {
            return false;
        }
        try {
            URI uri = new URI(value);
            String scheme = uri.getScheme();
            return scheme != null
                    && URL_SCHEMES.contains(scheme.toLowerCase(Locale.ROOT))
                    && uri.getHost() != null
                    && !uri.getHost().isEmpty();
        } catch (URISyntaxException e) {
            return false;
        }
    }
}

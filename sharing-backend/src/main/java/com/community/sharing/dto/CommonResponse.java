package com.community.sharing.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * 通用API响应结构 DTO
 * 成功时填充 message/data，失败时填充 error（校验失败另有 messages），空字段不输出。
 *
 * @param <T> 业务数据类型
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CommonResponse<T> implements Serializable {

    // 状态码：200, 201, 400, 401, 403, 404, 500
    private Integer code;

    // 响应描述信息
    private String message;

    // 业务数据 (可以是任何DTO, List, 或 null)
    private T data;

    // 错误标题，仅失败响应
    private String error;

    // 字段 → 原因，仅校验失败响应
    private Map<String, String> messages;

    // 响应时间戳 (ms)
    private Long timestamp;

    // --- 静态构造方法 (成功响应) ---

    public static <T> CommonResponse<T> success(T data) {
        return success("OK", data);
    }

    public static <T> CommonResponse<T> success(String message, T data) {
        return new CommonResponse<>(200, message, data, null, null, Instant.now().toEpochMilli());
    }

    /**
     * 构造创建成功响应 (状态码 201)
     */
    public static <T> CommonResponse<T> created(String message, T data) {
        return new CommonResponse<>(201, message, data, null, null, Instant.now().toEpochMilli());
    }

    // --- 静态构造方法 (错误响应) ---

    /**
     * 构造失败响应
     * @param code 状态码 (如 400, 500)
     * @param error 错误标题
     * @param message 附加说明，可为 null
     */
    public static <T> CommonResponse<T> error(Integer code, String error, String message) {
        return new CommonResponse<>(code, message, null, error, null, Instant.now().toEpochMilli());
    }

    public static <T> CommonResponse<T> validationError(String error, Map<String, String> messages) {
        return new CommonResponse<>(400, null, null, error, messages, Instant.now().toEpochMilli());
    }
}

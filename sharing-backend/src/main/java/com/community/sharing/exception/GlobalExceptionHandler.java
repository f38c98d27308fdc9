package com.community.sharing.exception;

import com.community.sharing.dto.CommonResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.Map;

/**
 * 统一异常处理：业务异常按其状态码返回，其余异常一律 500。
 * 抛出异常时 @Transactional 事务已回滚，这里只负责写响应。
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ValidationFailedException.class)
    public ResponseEntity<CommonResponse<Void>> handleValidation(ValidationFailedException exc) {
        return ResponseEntity.badRequest()
                .body(CommonResponse.validationError(exc.getError(), exc.getMessages()));
    }

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<CommonResponse<Void>> handleApiException(ApiException exc) {
        HttpStatus status = exc.getStatus();
        return ResponseEntity.status(status)
                .body(CommonResponse.error(status.value(), exc.getError(), exc.getDetail()));
    }

    // 请求体不是合法 JSON 对象
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<CommonResponse<Void>> handleUnreadableBody(HttpMessageNotReadableException exc) {
        return ResponseEntity.badRequest()
                .body(CommonResponse.validationError("Validation failed",
                        Map.of(ValidationFailedException.SCHEMA_KEY, "Invalid input type.")));
    }

    /**
     * 路径中的 ID 不是合法 UUID，按资源不存在处理
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<CommonResponse<Void>> handleTypeMismatch(MethodArgumentTypeMismatchException exc) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(CommonResponse.error(HttpStatus.NOT_FOUND.value(), "Not found", null));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<CommonResponse<Void>> handleNoResource(NoResourceFoundException exc) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(CommonResponse.error(HttpStatus.NOT_FOUND.value(), "Not found", null));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<CommonResponse<Void>> handleMethodNotSupported(HttpRequestMethodNotSupportedException exc) {
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
                .body(CommonResponse.error(HttpStatus.METHOD_NOT_ALLOWED.value(), "Method not allowed", exc.getMessage()));
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<CommonResponse<Void>> handleMediaType(HttpMediaTypeNotSupportedException exc) {
        return ResponseEntity.status(HttpStatus.UNSUPPORTED_MEDIA_TYPE)
                .body(CommonResponse.error(HttpStatus.UNSUPPORTED_MEDIA_TYPE.value(),
                        "Unsupported media type", "Request body must be application/json"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<CommonResponse<Void>> handleGeneralException(Exception exc) {
        log.error("未处理的异常", exc);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(CommonResponse.error(HttpStatus.INTERNAL_SERVER_ERROR.value(), "Internal server error", null));
    }
}

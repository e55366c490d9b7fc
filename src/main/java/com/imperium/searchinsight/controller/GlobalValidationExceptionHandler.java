package com.imperium.searchinsight.controller;

import com.imperium.searchinsight.config.RequestIdSupport;
import com.imperium.searchinsight.exception.SearchValidationException;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.HashMap;
import java.util.Map;

/**
 * 全局校验异常处理：统一返回 400 {"error":{code,message,requestId,details}}。
 */
@RestControllerAdvice
public class GlobalValidationExceptionHandler {

    private static final String INVALID_ARGUMENT = "invalid_argument";

    @ExceptionHandler(SearchValidationException.class)
    public ResponseEntity<Map<String, Object>> handleSearchValidation(SearchValidationException ex) {
        return badRequest(ex.getMessage(), ex.getField());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(err -> err.getDefaultMessage())
                .orElse("Validation failed");
        String field = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(err -> err.getField())
                .orElse(null);
        return badRequest(message, field);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, Object>> handleMissingParameter(MissingServletRequestParameterException ex) {
        return badRequest(ex.getParameterName() + " is required", ex.getParameterName());
    }

    /**
     * 请求体无法解析；params 中的未知字段在反序列化时抛出 SearchValidationException，这里还原其消息。
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        Throwable cause = ex.getCause();
        while (cause != null) {
            if (cause instanceof SearchValidationException sve) {
                return badRequest(sve.getMessage(), sve.getField());
            }
            cause = cause.getCause();
        }
        return badRequest("Malformed request body", null);
    }

    private static ResponseEntity<Map<String, Object>> badRequest(String message, String field) {
        Map<String, Object> err = new HashMap<>();
        err.put("code", INVALID_ARGUMENT);
        err.put("message", message);
        err.put("requestId", resolveRequestId());
        if (field != null) {
            err.put("details", Map.of("field", field));
        }
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("error", err));
    }

    private static String resolveRequestId() {
        ServletRequestAttributes attributes = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        if (attributes == null) {
            return RequestIdSupport.newRequestId();
        }
        HttpServletRequest request = attributes.getRequest();
        return RequestIdSupport.resolve(request);
    }
}

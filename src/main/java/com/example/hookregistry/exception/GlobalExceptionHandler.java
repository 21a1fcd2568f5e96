package com.example.hookregistry.exception;

import com.example.hookregistry.model.WebhookSubscription;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 全局异常处理逻辑
 * 领域异常映射为对应的 HTTP 状态码，未预期的异常统一返回 500，不向调用方泄露堆栈信息。
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(SubscriptionNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(SubscriptionNotFoundException e,
            HttpServletRequest request) {
        log.debug("[NotFound] Path: {}, Subscription: {}", request.getRequestURI(), e.getSubscriptionId());
        return error(HttpStatus.NOT_FOUND, e.getMessage(), request);
    }

    /**
     * 重复注册 (409)，附带冲突前已创建的订阅 ID
     */
    @ExceptionHandler(SubscriptionConflictException.class)
    public ResponseEntity<Map<String, Object>> handleConflict(SubscriptionConflictException e,
            HttpServletRequest request) {
        log.warn("[Conflict] Path: {}, Event: {}", request.getRequestURI(), e.getEventName());
        ResponseEntity<Map<String, Object>> response = error(HttpStatus.CONFLICT, e.getMessage(), request);
        response.getBody().put("eventName", e.getEventName());
        response.getBody().put("createdIds", e.getCreated().stream()
                .map(WebhookSubscription::getId)
                .collect(Collectors.toList()));
        return response;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidBody(MethodArgumentNotValidException e,
            HttpServletRequest request) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(err -> err.getField() + ": " + err.getDefaultMessage())
                .collect(Collectors.joining("; "));
        log.warn("[BadRequest] Path: {}, Error: {}", request.getRequestURI(), message);
        return error(HttpStatus.BAD_REQUEST, message, request);
    }

    /**
     * 其他请求错误 (400)：缺少请求头/参数、参数类型错误、请求体无法解析、URL 校验失败等
     */
    @ExceptionHandler({ IllegalArgumentException.class, ConstraintViolationException.class,
            MissingRequestHeaderException.class, MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class, HttpMessageNotReadableException.class,
            HandlerMethodValidationException.class })
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e, HttpServletRequest request) {
        log.warn("[BadRequest] Path: {}, Error: {}", request.getRequestURI(), e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getMessage(), request);
    }

    /**
     * 处理资源未找到异常 (404)
     */
    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNoResource(NoResourceFoundException e,
            HttpServletRequest request) {
        log.debug("[ResourceNotFound] Path: {}", request.getRequestURI());
        return error(HttpStatus.NOT_FOUND, "Not Found", request);
    }

    /**
     * 兜底：存储层等未预期的异常原样记录，统一返回 500
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleException(Exception e, HttpServletRequest request) {
        log.error("[GlobalException] Path: {}, Error: {}", request.getRequestURI(), e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred. Please contact administrator.", request);
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String message,
            HttpServletRequest request) {
        Map<String, Object> error = new HashMap<>();
        error.put("status", status.value());
        error.put("error", status.getReasonPhrase());
        error.put("message", message);
        error.put("path", request.getRequestURI());
        return new ResponseEntity<>(error, status);
    }
}

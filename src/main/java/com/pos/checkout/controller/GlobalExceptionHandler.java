package com.pos.checkout.controller;

import com.pos.checkout.dto.CheckoutResult;
import com.pos.checkout.exception.CheckoutErrorKind;
import com.pos.checkout.exception.CheckoutException;
import com.pos.checkout.util.TraceIdUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.HashMap;
import java.util.Map;

/**
 * 全局异常处理，将控制器抛出的异常渲染为结账失败格式。
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(CheckoutException.class)
    public ResponseEntity<CheckoutResult> handleCheckoutException(CheckoutException e) {
        log.warn("[请求失败] kind={}, errorMsg={}, traceId={}", e.getKind(), e.getMessage(), TraceIdUtil.getTraceId());
        CheckoutResult result = CheckoutResult.failure(e.getKind(), e.getMessage(), TraceIdUtil.getTraceId());
        return ResponseEntity.status(result.httpStatus()).body(result);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<CheckoutResult> handleUnreadable(Exception e) {
        log.warn("[请求格式错误] errorMsg={}, traceId={}", e.getMessage(), TraceIdUtil.getTraceId());
        CheckoutResult result = CheckoutResult.failure(CheckoutErrorKind.VALIDATION_ERROR,
                "Malformed request", TraceIdUtil.getTraceId());
        return ResponseEntity.badRequest().body(result);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(IllegalArgumentException e) {
        Map<String, Object> response = new HashMap<>();
        response.put("code", "NOT_FOUND");
        response.put("message", e.getMessage());
        response.put("traceId", TraceIdUtil.getTraceId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<CheckoutResult> handleUnexpected(Exception e) {
        log.error("[未处理异常] errorMsg={}, traceId={}", e.getMessage(), TraceIdUtil.getTraceId(), e);
        CheckoutResult result = CheckoutResult.failure(CheckoutErrorKind.INTERNAL_ERROR, e.getMessage(),
                TraceIdUtil.getTraceId());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result);
    }
}

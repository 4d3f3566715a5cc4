package com.example.kosagent.controller;

import com.example.kosagent.exception.GatewayExhaustedException;
import com.example.kosagent.exception.WorkflowValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(WorkflowValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(WorkflowValidationException ex) {
        log.warn("[REST API] 请求校验失败: {}", ex.getViolations());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "validation_failed");
        body.put("details", ex.getViolations());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler(GatewayExhaustedException.class)
    public ResponseEntity<Map<String, Object>> handleGateway(GatewayExhaustedException ex) {
        log.error("[REST API] 模型网关不可用: {}", ex.getMessage());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "llm_unavailable");
        body.put("details", ex.getLastFailures());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }
}

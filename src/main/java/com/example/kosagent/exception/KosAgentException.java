package com.example.kosagent.exception;

/**
 * 编排核心的异常基类（非受检）
 */
public class KosAgentException extends RuntimeException {

    public KosAgentException(String message) {
        super(message);
    }

    public KosAgentException(String message, Throwable cause) {
        super(message, cause);
    }
}

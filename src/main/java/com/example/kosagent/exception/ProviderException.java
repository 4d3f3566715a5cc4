package com.example.kosagent.exception;

import lombok.Getter;

/**
 * 单个模型提供方调用失败
 */
@Getter
public abstract class ProviderException extends KosAgentException {

    private final String provider;

    protected ProviderException(String provider, String message) {
        super("[" + provider + "] " + message);
        this.provider = provider;
    }

    protected ProviderException(String provider, String message, Throwable cause) {
        super("[" + provider + "] " + message, cause);
        this.provider = provider;
    }

    /**
     * 是否允许在同一提供方上重试
     */
    public abstract boolean isRetryable();
}
